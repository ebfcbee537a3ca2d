/*
 * Copyright 2012 TouK
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package pl.touk.charon.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import pl.touk.charon.Utils;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link StatusCache} backed by Caffeine. Suitable when only one application instance monitors the
 * connections. Every entry expires after the TTL given when it was last put; reads do not extend it.
 */
public class InMemoryStatusCache implements GroupInvalidatingStatusCache {

    private static final Executor callingThreadExecutor = new Executor() {
        public void execute(Runnable command) {
            command.run();
        }
    };

    private static final Expiry<String, Entry> ttlOfLastPut = new Expiry<String, Entry>() {
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos;
        }

        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    };

    private final Cache<String, Entry> entries;

    public InMemoryStatusCache() {
        this(Ticker.systemTicker());
    }

    public InMemoryStatusCache(Ticker ticker) {
        Utils.assertNotNull(ticker, "ticker");
        entries = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(callingThreadExecutor)
                .expireAfter(ttlOfLastPut)
                .build();
    }

    public String get(String key) {
        Utils.assertNotNull(key, "key");
        Entry e = entries.getIfPresent(key);
        return e != null ? e.value : null;
    }

    public void put(String key, String value, int ttlSeconds) {
        Utils.assertNotNull(key, "key");
        Utils.assertNotNull(value, "value");
        Utils.assertPositive(ttlSeconds, "ttlSeconds");
        entries.put(key, new Entry(value, TimeUnit.SECONDS.toNanos(ttlSeconds)));
    }

    public int invalidateGroup(String keyPrefix) {
        Utils.assertNotNull(keyPrefix, "keyPrefix");
        Map<String, Entry> map = entries.asMap();
        int removed = 0;
        for (String key : map.keySet()) {
            if (key.startsWith(keyPrefix) && map.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * @return the number of live entries, after expired ones are evicted
     */
    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private static final class Entry {
        private final String value;
        private final long ttlNanos;

        private Entry(String value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }
}
