package org.dendrite.pulse.filesystem;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 调用方的取消/超时信号；目录枚举在解析每个子条目之前检查一次。
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();

    /**
     * 截止时间到达或当前线程被中断时视为取消。
     */
    static CancellationSignal deadline(Duration timeout, Clock clock) {
        Instant deadline = clock.instant().plus(timeout);
        return () -> Thread.currentThread().isInterrupted() || !clock.instant().isBefore(deadline);
    }
}
