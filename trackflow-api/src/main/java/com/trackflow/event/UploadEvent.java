package com.trackflow.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An object was created in an upload area. The key may still be URL encoded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UploadEvent {

    @JsonProperty("area")
    private String area;

    @JsonProperty("key")
    private String key;

    @JsonProperty("size")
    private Long size;
}
