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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process lock factory, for deployments with a single engine instance.
 */
public class LocalLockFactory implements LockFactory {

    private static final Logger log =
        LoggerFactory.getLogger(LocalLockFactory.class);

    private final ConcurrentMap<String, ReentrantLock> locks =
        new ConcurrentHashMap<>();

    @Override
    public ClusterLock acquire(@Nonnull String name)
            throws StateAccessException {
        Preconditions.checkNotNull(name);
        ReentrantLock lock = locks.computeIfAbsent(name,
                                                   n -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateAccessException("Interrupted while acquiring lock "
                                           + name, e);
        }
        log.debug("Acquired lock {}", name);
        return new HeldLock(name, lock);
    }

    /**
     * @return Whether the named lock is currently held by any thread.
     */
    public boolean isLocked(String name) {
        ReentrantLock lock = locks.get(name);
        return lock != null && lock.isLocked();
    }

    private static class HeldLock implements ClusterLock {

        private final String name;
        private final ReentrantLock lock;
        private boolean released = false;

        HeldLock(String name, ReentrantLock lock) {
            this.name = name;
            this.lock = lock;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
                log.debug("Released lock {}", name);
            }
        }
    }
}
