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

import com.google.common.base.Preconditions;
import com.google.inject.Inject;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.recipes.locks.InterProcessMutex;
import org.apache.curator.utils.ZKPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.cluster.config.ZookeeperConfig;

/**
 * Lock factory backed by Curator lock recipes, shared by every process
 * connected to the same ZooKeeper ensemble and root key.
 */
public class ZookeeperLockFactory implements LockFactory {

    private static final Logger log =
        LoggerFactory.getLogger(ZookeeperLockFactory.class);

    public static final String LOCKS_PATH = "locks";

    private final CuratorFramework client;
    private final String locksPath;

    @Inject
    public ZookeeperLockFactory(CuratorFramework client,
                                ZookeeperConfig config) {
        this(client, config.rootKey());
    }

    public ZookeeperLockFactory(CuratorFramework client, String rootKey) {
        this.client = client;
        this.locksPath = ZKPaths.makePath(rootKey, LOCKS_PATH);
    }

    /**
     * Construct a new InterProcessMutex object, which is a re-entrant shared
     * lock.
     *
     * @param name Name of the lock to create.  A lock is global so if you
     *             call this method twice with the same name, the returned
     *             object is referring to the same lock (Zookeeper path).
     * @return InterProcessMutex shared lock object
     */
    public InterProcessMutex createShared(@Nonnull String name) {
        Preconditions.checkNotNull(name);
        Preconditions.checkArgument(!name.isEmpty() && !name.contains("/"),
                                    "Invalid lock name: %s", name);
        log.debug("Constructing a lock with name {}", name);

        return new InterProcessMutex(client, getLockPath(name));
    }

    public String getLockPath(String name) {
        return ZKPaths.makePath(locksPath, name);
    }

    @Override
    public ClusterLock acquire(@Nonnull String name)
            throws StateAccessException {
        InterProcessMutex mutex = createShared(name);
        try {
            mutex.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateAccessException(
                "Interrupted while acquiring lock " + name, e);
        } catch (Exception e) {
            throw new StateAccessException("Failed to acquire lock " + name, e);
        }
        log.debug("Acquired lock {}", name);
        return new MutexLock(name, mutex);
    }

    private static class MutexLock implements ClusterLock {

        private final String name;
        private final InterProcessMutex mutex;
        private boolean released = false;

        MutexLock(String name, InterProcessMutex mutex) {
            this.name = name;
            this.mutex = mutex;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void close() throws StateAccessException {
            if (released) {
                return;
            }
            released = true;
            try {
                mutex.release();
                log.debug("Released lock {}", name);
            } catch (Exception e) {
                throw new StateAccessException("Failed to release lock "
                                               + name, e);
            }
        }
    }
}
