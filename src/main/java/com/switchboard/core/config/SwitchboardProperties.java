package com.switchboard.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchboard")
public class SwitchboardProperties {

    /** Unit that receives quality-gate escalations. */
    private String rootAuthority = "ORCHESTRATOR";

    private Store store = new Store();

    public String getRootAuthority() {
        return rootAuthority;
    }

    public void setRootAuthority(String rootAuthority) {
        this.rootAuthority = rootAuthority;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public static class Store {
        private int queryLimit = 100;

        public int getQueryLimit() {
            return queryLimit;
        }

        public void setQueryLimit(int queryLimit) {
            this.queryLimit = queryLimit;
        }
    }
}
