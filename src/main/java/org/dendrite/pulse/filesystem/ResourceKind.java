package org.dendrite.pulse.filesystem;

/**
 * 路径本身的类型（不跟随符号链接）。
 */
public enum ResourceKind {
    FILE("file"),
    FOLDER("folder"),
    SYMLINK("symlink");

    private final String token;

    ResourceKind(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
