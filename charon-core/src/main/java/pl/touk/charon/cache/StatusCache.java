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

/**
 * Key-value store with per-key time-to-live in which connection health is persisted. The store is the only source
 * of truth shared by all processes monitoring the same connections.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public interface StatusCache {

    /**
     * @return the value stored under the given key or <code>null</code> if there is no such value or it has expired
     * @throws CacheAccessException if the store is unavailable
     */
    String get(String key) throws CacheAccessException;

    /**
     * Stores the value under the given key replacing any previous value. The value expires after
     * <code>ttlSeconds</code>.
     *
     * @throws CacheAccessException if the store is unavailable
     */
    void put(String key, String value, int ttlSeconds) throws CacheAccessException;
}
