package io.looming.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A declared act input. Resolved into backend-ready content at run time.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextInput.class, name = "text"),
        @JsonSubTypes.Type(value = TableInput.class, name = "table"),
        @JsonSubTypes.Type(value = PlatformCommandInput.class, name = "platform_command")
})
public interface Input {
    InputKind kind();

    HistoryRetention retention();
}
