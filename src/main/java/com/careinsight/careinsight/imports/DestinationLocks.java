package com.careinsight.careinsight.imports;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One writer at a time per destination table within this process.
 */
@Component
public class DestinationLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock forTable(String tableName) {
        return locks.computeIfAbsent(tableName.toLowerCase(Locale.ROOT), key -> new ReentrantLock(true));
    }
}
