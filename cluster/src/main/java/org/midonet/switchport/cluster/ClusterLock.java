/*
 * Copyright 2018 Midokura SARL
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
package org.midonet.switchport.cluster;

/**
 * A held named lock. Closing it releases the lock, so callers scope the
 * critical section with try-with-resources:
 *
 * <pre>
 *     try (ClusterLock lock = lockFactory.acquire(switchName)) {
 *         // re-read, decide, apply
 *     }
 * </pre>
 */
public interface ClusterLock extends AutoCloseable {

    /**
     * @return The name the lock was acquired with.
     */
    String name();

    /**
     * Releases the lock. Calling it more than once has no effect.
     */
    @Override
    void close() throws StateAccessException;
}
