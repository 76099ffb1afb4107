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
package org.midonet.switchport.services;

import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.AbstractService;
import com.google.inject.Inject;
import org.apache.curator.framework.CuratorFramework;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.cluster.config.ZookeeperConfig;
import org.midonet.switchport.inventory.SwitchInventory;

/**
 * Connects to ZooKeeper, when switch locks go through it, before any event
 * is handled, and disconnects on shutdown.
 */
public class SwitchPortService extends AbstractService {

    private static final Logger log =
        LoggerFactory.getLogger(SwitchPortService.class);

    @Inject
    protected SwitchInventory inventory;

    @Inject
    protected ZookeeperConfig zkConfig;

    /** Not bound when locks are local to this process. */
    @Inject(optional = true)
    protected CuratorFramework curator;

    @Override
    protected void doStart() {
        try {
            if (curator != null) {
                log.info("Connecting to ZooKeeper at {}", zkConfig.hosts());
                curator.start();
                if (!curator.blockUntilConnected(
                        zkConfig.connectionTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    throw new IllegalStateException(
                        "Could not connect to ZooKeeper at "
                        + zkConfig.hosts());
                }
            }
            log.info("Switch port reconciler started, managing {} switches",
                     inventory.switches().size());
            notifyStarted();
        } catch (Exception e) {
            log.error("Failed to start the switch port reconciler", e);
            notifyFailed(e);
        }
    }

    @Override
    protected void doStop() {
        if (curator != null) {
            curator.close();
        }
        log.info("Switch port reconciler stopped");
        notifyStopped();
    }

    public boolean isUsingZookeeper() {
        return curator != null;
    }
}
