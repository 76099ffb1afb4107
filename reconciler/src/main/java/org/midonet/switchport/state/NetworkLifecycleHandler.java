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
package org.midonet.switchport.state;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.DeviceConfigurationException;
import org.midonet.switchport.MechanismDriverException;
import org.midonet.switchport.cluster.ClusterLock;
import org.midonet.switchport.cluster.LockFactory;
import org.midonet.switchport.cluster.StateAccessException;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.NetworkSegment;
import org.midonet.switchport.cluster.data.neutron.NeutronStore;
import org.midonet.switchport.device.DeviceGateway;
import org.midonet.switchport.device.DeviceOperationException;
import org.midonet.switchport.inventory.SwitchIdentity;
import org.midonet.switchport.inventory.SwitchInventory;

/**
 * Creates and deletes the VLAN of VLAN networks on every switch that
 * manages VLANs.
 *
 * The switch lock only orders the device calls of this driver; the store
 * keeps changing while they wait for it. So once the lock is granted the
 * network is read again, and the event is dropped if it no longer matches
 * the store.
 */
public class NetworkLifecycleHandler {

    private static final Logger log =
        LoggerFactory.getLogger(NetworkLifecycleHandler.class);

    private final NeutronStore store;
    private final SwitchInventory inventory;
    private final DeviceGateway gateway;
    private final LockFactory lockFactory;

    private final Counter deviceOperations;
    private final Counter deviceFailures;
    private final Counter staleDiscards;

    @Inject
    public NetworkLifecycleHandler(NeutronStore store,
                                   SwitchInventory inventory,
                                   DeviceGateway gateway,
                                   LockFactory lockFactory,
                                   MetricRegistry metrics) {
        this.store = store;
        this.inventory = inventory;
        this.gateway = gateway;
        this.lockFactory = lockFactory;
        Class<?> clazz = NetworkLifecycleHandler.class;
        this.deviceOperations =
            metrics.counter(MetricRegistry.name(clazz, "deviceOperations"));
        this.deviceFailures =
            metrics.counter(MetricRegistry.name(clazz, "deviceFailures"));
        this.staleDiscards =
            metrics.counter(MetricRegistry.name(clazz, "staleDiscards"));
    }

    /**
     * Creates the VLAN of a new network. Stops at the first switch that
     * finds the network deleted, or no longer carrying the VLAN.
     */
    public void onNetworkCreate(Network network)
            throws MechanismDriverException, StateAccessException {
        Integer segmentationId = network.segmentationId();
        if (!network.isVlan() || segmentationId == null) {
            log.debug("Network {} is not a VLAN network, ignoring",
                      network.id);
            return;
        }

        for (SwitchIdentity sw : inventory.vlanManagedSwitches()) {
            String switchName = sw.getName();
            try (ClusterLock lock = lockFactory.acquire(switchName)) {
                Network current = store.getNetwork(network.id);
                if (current == null) {
                    log.debug("Network {} was deleted, discarding VLAN {} "
                              + "creation", network.id, segmentationId);
                    staleDiscards.inc();
                    return;
                }
                if (!current.hasSegmentationId(segmentationId)) {
                    log.debug("Network {} no longer has segmentation id {}, "
                              + "discarding VLAN creation", network.id,
                              segmentationId);
                    staleDiscards.inc();
                    return;
                }

                try {
                    deviceOperations.inc();
                    gateway.createVlan(switchName, segmentationId);
                } catch (DeviceOperationException e) {
                    deviceFailures.inc();
                    log.error("Failed to create network {} on switch {}",
                              network.id, switchName, e);
                    throw new DeviceConfigurationException(
                        "Failed to create VLAN " + segmentationId + " of "
                        + "network " + network.id + " on " + switchName, e);
                }
                log.info("Network {}, segmentation {} has been added on "
                         + "switch {}", network.id, segmentationId,
                         switchName);
            }
        }
    }

    /**
     * Deletes the VLAN of a deleted network. Stops at the first switch that
     * finds a VLAN segment with the same id on the same physical network,
     * which means the VLAN was allocated again in the meantime.
     */
    public void onNetworkDelete(Network network)
            throws MechanismDriverException, StateAccessException {
        Integer segmentationId = network.segmentationId();
        String physnet = network.physicalNetwork();
        if (!network.isVlan() || segmentationId == null) {
            log.debug("Network {} is not a VLAN network, ignoring",
                      network.id);
            return;
        }

        for (SwitchIdentity sw : inventory.vlanManagedSwitches()) {
            String switchName = sw.getName();
            try (ClusterLock lock = lockFactory.acquire(switchName)) {
                for (NetworkSegment seg : store.getSegments(segmentationId)) {
                    if (seg.isVlan(segmentationId, physnet)) {
                        log.debug("Not deleting segment {} from {} because "
                                  + "it was recreated", segmentationId,
                                  physnet);
                        staleDiscards.inc();
                        return;
                    }
                }

                try {
                    deviceOperations.inc();
                    gateway.deleteVlan(switchName, segmentationId);
                } catch (DeviceOperationException e) {
                    deviceFailures.inc();
                    log.error("Failed to delete network {} on switch {}",
                              network.id, switchName, e);
                    throw new DeviceConfigurationException(
                        "Failed to delete VLAN " + segmentationId + " of "
                        + "network " + network.id + " on " + switchName, e);
                }
                log.info("Network {} has been deleted on switch {}",
                         network.id, switchName);
            }
        }
    }
}
