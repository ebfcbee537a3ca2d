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
 * {@link StatusCache} able to remove all entries belonging to one group at once. Entries are grouped by a common key
 * prefix.
 */
public interface GroupInvalidatingStatusCache extends StatusCache {

    /**
     * Removes all entries whose keys start with the given prefix.
     *
     * @return number of removed entries or <code>-1</code> if the store does not know it
     * @throws CacheAccessException if the store is unavailable
     */
    int invalidateGroup(String keyPrefix) throws CacheAccessException;
}
