package com.github.liyibo1110.pantry.cache;

import java.io.Serializable;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 后台任务保活钩子
 * revalidateOnGet触发的revalidation是脱离调用方的后台任务，调用方不会等待它，也拿不到取消句柄
 * 如果宿主环境会在空闲时挂起或销毁执行环境（例如worker、请求作用域的线程池），就需要在这里把future登记出去，
 * 由宿主保证它在销毁前完成，cache自身无法保证这一点
 * @author liyibo
 * @date 2026-10-12 11:30
 */
@FunctionalInterface
public interface KeepAlive {

    /**
     * 登记一个已经启动的后台任务
     */
    void keepAlive(CompletableFuture<?> task);

    static KeepAlive disabledKeepAlive() {
        return DisabledKeepAlive.INSTANCE;
    }

    static KeepAlive guardedKeepAlive(KeepAlive keepAlive) {
        return (keepAlive instanceof GuardedKeepAlive || keepAlive == DisabledKeepAlive.INSTANCE)
                ? keepAlive
                : new GuardedKeepAlive(keepAlive);
    }
}

enum DisabledKeepAlive implements KeepAlive {
    INSTANCE;

    @Override
    public void keepAlive(CompletableFuture<?> task) {
        Objects.requireNonNull(task);
    }
}

/**
 * 吃掉钩子抛出的异常并log输出，不能影响get的调用方
 */
final class GuardedKeepAlive implements KeepAlive, Serializable {
    static final Logger logger = Logger.getLogger(GuardedKeepAlive.class.getName());
    static final long serialVersionUID = 1;

    final KeepAlive delegate;

    GuardedKeepAlive(KeepAlive delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public void keepAlive(CompletableFuture<?> task) {
        try {
            this.delegate.keepAlive(task);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by keep-alive hook; task is left detached", t);
        }
    }
}
