package org.dendrite.pulse.web;

import org.springframework.http.MediaType;

/**
 * JSON:API 相关常量。
 */
public final class JsonApi {

    public static final String CONTENT_TYPE = "application/vnd.api+json";

    public static final MediaType MEDIA_TYPE = MediaType.parseMediaType(CONTENT_TYPE);

    private JsonApi() {
    }
}
