package uk.gegc.planconfigurator.features.backend.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mapping table between a canonical shape and its backend wire shape.
 */
public record ShapeMapping(List<FieldMapping> fields) {

    public ShapeMapping {
        fields = List.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (FieldMapping field : fields) {
            if (!seen.add(field.canonicalPath())) {
                throw new IllegalArgumentException("Duplicate canonical field: " + field.canonicalPath());
            }
        }
    }

    public static ShapeMapping of(FieldMapping... fields) {
        return new ShapeMapping(List.of(fields));
    }
}
