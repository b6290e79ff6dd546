package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Claude image source, e.g. {@code {"type":"base64","media_type":"image/png","data":"..."}}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockImageSource {

    public static final String TYPE_BASE64 = "base64";

    @JsonProperty("type")
    String type;

    @JsonProperty("media_type")
    String mediaType;

    @JsonProperty("data")
    String data;

    @JsonCreator
    public BedrockImageSource(
            @JsonProperty("type") String type,
            @JsonProperty("media_type") String mediaType,
            @JsonProperty("data") String data) {
        this.type = type;
        this.mediaType = mediaType;
        this.data = data;
    }

    public static BedrockImageSource base64(String mediaType, String data) {
        return new BedrockImageSource(TYPE_BASE64, mediaType, data);
    }
}
