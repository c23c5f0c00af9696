package org.dendrite.pulse.web;

import org.dendrite.pulse.filesystem.dto.PingResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 存活探测。
 */
@RestController
public class PingController {

    static final String PING_PATH = "/api/v1/ping";

    @GetMapping(PING_PATH)
    public ResponseEntity<PingResponse> ping() {
        return ResponseEntity.ok()
                .contentType(JsonApi.MEDIA_TYPE)
                .body(PingResponse.pong(PING_PATH));
    }
}
