package org.dendrite.pulse.filesystem.dto;

/**
 * {@code /api/v1/ping} 的 JSON:API 文档。
 */
public record PingResponse(Meta meta, Links links, Data data) {

    public static PingResponse pong(String self) {
        return new PingResponse(
                new Meta(new Page(1, 1, 1, 1, 1, 1)),
                new Links(self, self, self),
                new Data("ping", "ping", new Attributes("pong"))
        );
    }

    public record Meta(Page page) {
    }

    public record Page(int currentPage, int from, int lastPage, int perPage, int to, int total) {
    }

    public record Links(String self, String first, String last) {
    }

    public record Data(String type, String id, Attributes attributes) {
    }

    public record Attributes(String message) {
    }
}
