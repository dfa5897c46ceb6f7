package io.github.yok.fixturelink.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One fixture record: the target entity, its primary key and its coerced field values.
 *
 * <p>
 * Serialized as {@code {"model": ..., "pk": ..., "fields": {...}}}. A field whose source value
 * was empty is absent from {@link #getFields()}; it is never stored as {@code null}. Field values
 * are integers, booleans or strings (the group membership list of users is the only list).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"model", "pk", "fields"})
public class FixtureRecord {

    @JsonProperty("model")
    private String entity;

    // Integer, or Long beyond the int range; null when the legacy row had no id
    @JsonProperty("pk")
    private Number primaryKey;

    private Map<String, Object> fields = new LinkedHashMap<>();
}
