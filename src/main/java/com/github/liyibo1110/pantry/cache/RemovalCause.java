package com.github.liyibo1110.pantry.cache;

/**
 * 一个cache条目被移除的原因
 * @author liyibo
 * @date 2026-10-12 11:05
 */
public enum RemovalCause {
    /**
     * 被用户手动地移除，涉及如下方法：
     * <ul>
     *   <li>{@link Cache#delete}</li>
     *   <li>{@link Cache#deleteAll}</li>
     * </ul>
     */
    EXPLICIT {
        @Override
        public boolean wasEvicted() {
            return false;
        }
    },

    /**
     * 条目本身未被移除，但是值被替换了，涉及如下方法：
     * <ul>
     *   <li>{@link Cache#set}</li>
     *   <li>resolver或revalidator成功返回了新值</li>
     *   <li>开启resetTtlOnGet后命中时的重新写入</li>
     * </ul>
     */
    REPLACED {
        @Override
        public boolean wasEvicted() {
            return false;
        }
    },

    /**
     * 条目到期，在读取时被惰性删除，或在淘汰扫描、cleanUp中被顺带清理
     */
    EXPIRED {
        @Override
        public boolean wasEvicted() {
            return true;
        }
    },

    /**
     * 因为maximumSize限制而被移除，淘汰的是写入时间最早的条目
     */
    SIZE {
        @Override
        public boolean wasEvicted() {
            return true;
        }
    },

    /**
     * revalidation没有得到任何值，条目被认为已经失效而移除
     */
    INVALIDATED {
        @Override
        public boolean wasEvicted() {
            return false;
        }
    };

    /**
     * 如果由于被驱逐而移除，则返回true（EXPLICIT、REPLACED和INVALIDATED返回false）
     */
    public abstract boolean wasEvicted();
}
