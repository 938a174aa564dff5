package com.github.liyibo1110.pantry.cache;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 异步操作相关工具
 * @author liyibo
 * @date 2026-10-13 16:32
 */
final class Async {

    private Async() {}

    /**
     * 剥掉CompletableFuture链路上包装出来的CompletionException和ExecutionException
     */
    static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * 取消和超时是调用方主动造成的，不需要记录警告
     */
    static boolean shouldLog(Throwable error) {
        Throwable cause = unwrap(error);
        return !(cause instanceof CancellationException) && !(cause instanceof TimeoutException);
    }
}
