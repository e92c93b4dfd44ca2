package com.switchboard.core.registry;

import com.switchboard.core.model.UnitRole;
import com.switchboard.core.unit.CapabilityUnit;
import com.switchboard.core.unit.UnitOwner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps stable unit ids to their single instance.
 * <p>
 * Built once at startup from every {@link CapabilityUnit} bean: units are stored in an immutable
 * list ordered by {@link UnitId} declaration, with an id-to-index lookup beside it. Construction
 * also hands each unit to the supervisor named in its {@code reportsTo} and initializes everything.
 */
@Component
public class UnitRegistry {

    private static final Logger log = LoggerFactory.getLogger(UnitRegistry.class);

    private final List<CapabilityUnit> units;
    private final Map<String, Integer> indexById;

    public UnitRegistry(List<CapabilityUnit> candidates) {
        var sorted = new ArrayList<CapabilityUnit>(candidates);
        for (CapabilityUnit unit : sorted) {
            if (UnitId.parse(unit.id()).isEmpty()) {
                throw new IllegalStateException("Unknown unit id: " + unit.id());
            }
        }
        sorted.sort(Comparator.comparingInt(u -> UnitId.valueOf(u.id()).ordinal()));

        var index = new HashMap<String, Integer>();
        for (int i = 0; i < sorted.size(); i++) {
            if (index.putIfAbsent(sorted.get(i).id(), i) != null) {
                throw new IllegalStateException("Duplicate unit id: " + sorted.get(i).id());
            }
        }
        this.units = Collections.unmodifiableList(sorted);
        this.indexById = Map.copyOf(index);

        wireOwners();
        units.forEach(CapabilityUnit::initialize);
        log.info("Unit registry built with {} units", units.size());
    }

    /**
     * Resolves a unit by id. Unknown ids give an empty result rather than an exception.
     */
    public Optional<CapabilityUnit> resolve(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Integer index = indexById.get(id);
        return index != null ? Optional.of(units.get(index)) : Optional.empty();
    }

    public boolean isValidId(String id) {
        return UnitId.parse(id).isPresent();
    }

    public List<String> listIds() {
        return units.stream().map(CapabilityUnit::id).toList();
    }

    public List<String> listIds(UnitRole role) {
        if (role == null) {
            return listIds();
        }
        return units.stream()
                .filter(u -> u.identity().role() == role)
                .map(CapabilityUnit::id)
                .toList();
    }

    public List<CapabilityUnit> all() {
        return units;
    }

    private void wireOwners() {
        for (CapabilityUnit unit : units) {
            String ownerId = unit.identity().reportsTo();
            if (ownerId == null) {
                continue;
            }
            Optional<CapabilityUnit> owner = resolve(ownerId);
            if (owner.isPresent() && owner.get() instanceof UnitOwner supervisor) {
                supervisor.registerUnit(unit);
            } else {
                log.warn("Unit {} reports to {}, which is not a registered supervisor", unit.id(), ownerId);
            }
        }
    }
}
