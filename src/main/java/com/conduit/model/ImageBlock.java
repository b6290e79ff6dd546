package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Objects;

/**
 * Image content in OpenAI {@code image_url} form. Base64 images use a {@code data:} URL.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageBlock implements ContentBlock {

    public static final String TYPE = "image_url";

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    @JsonProperty("image_url")
    ImageUrl imageUrl;

    @JsonCreator
    public ImageBlock(@JsonProperty("image_url") ImageUrl imageUrl) {
        this.imageUrl = Objects.requireNonNull(imageUrl, "image_url block requires image_url");
    }

    public static ImageBlock fromBase64(String mediaType, String data) {
        return new ImageBlock(new ImageUrl(DATA_URL_PREFIX + mediaType + BASE64_MARKER + data, null));
    }

    @Override
    public String getType() {
        return TYPE;
    }

    /**
     * @return true when the URL is a base64 {@code data:} URL
     */
    @JsonIgnore
    public boolean isDataUrl() {
        String url = imageUrl.getUrl();
        return url.startsWith(DATA_URL_PREFIX) && url.contains(BASE64_MARKER);
    }

    /**
     * Media type of a data URL, e.g. {@code image/png}.
     */
    public String mediaType() {
        String url = imageUrl.getUrl();
        return url.substring(DATA_URL_PREFIX.length(), url.indexOf(BASE64_MARKER));
    }

    /**
     * Base64 payload of a data URL.
     */
    public String base64Data() {
        String url = imageUrl.getUrl();
        return url.substring(url.indexOf(BASE64_MARKER) + BASE64_MARKER.length());
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ImageUrl {

        @JsonProperty("url")
        String url;

        @JsonProperty("detail")
        String detail;

        @JsonCreator
        public ImageUrl(@JsonProperty("url") String url, @JsonProperty("detail") String detail) {
            this.url = Objects.requireNonNull(url, "image_url requires url");
            this.detail = detail;
        }
    }
}
