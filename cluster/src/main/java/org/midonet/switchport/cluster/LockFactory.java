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

import javax.annotation.Nonnull;

/**
 * Grants mutually exclusive locks keyed by name. Two acquisitions with the
 * same name, from any thread or any process sharing the same coordination
 * service, refer to the same lock. The lock is re-entrant for the thread
 * holding it.
 */
public interface LockFactory {

    /**
     * Blocks until the named lock is held by the calling thread.
     *
     * @param name Name of the lock, typically a switch name.
     * @return The held lock, to be closed on every exit path.
     * @throws StateAccessException if the coordination service failed while
     *                              acquiring the lock.
     */
    ClusterLock acquire(@Nonnull String name) throws StateAccessException;
}
