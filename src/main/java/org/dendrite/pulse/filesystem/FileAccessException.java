package org.dendrite.pulse.filesystem;

/**
 * 文件访问失败。
 * <p>
 * 消息中只包含虚拟路径，不包含宿主机绝对路径。
 */
public class FileAccessException extends RuntimeException {

    public enum Reason {
        ROOT_NOT_FOUND,
        OUTSIDE_ROOT,
        INVALID_PATH,
        NOT_A_DIRECTORY,
        NOT_FOUND,
        PERMISSION_DENIED,
        STAT_FAILURE,
        CANCELED
    }

    private final Reason reason;
    private final String virtualPath;

    public FileAccessException(Reason reason, String virtualPath, String message) {
        this(reason, virtualPath, message, null);
    }

    public FileAccessException(Reason reason, String virtualPath, String message, Throwable cause) {
        super(message + "：" + virtualPath, cause);
        this.reason = reason;
        this.virtualPath = virtualPath;
    }

    public Reason getReason() {
        return reason;
    }

    public String getVirtualPath() {
        return virtualPath;
    }
}
