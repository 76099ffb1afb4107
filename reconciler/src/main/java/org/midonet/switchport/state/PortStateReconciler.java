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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.DeviceConfigurationException;
import org.midonet.switchport.InvalidArgumentException;
import org.midonet.switchport.MechanismDriverException;
import org.midonet.switchport.NetworkNotFoundException;
import org.midonet.switchport.UnknownSwitchException;
import org.midonet.switchport.cluster.ClusterLock;
import org.midonet.switchport.cluster.LockFactory;
import org.midonet.switchport.cluster.StateAccessException;
import org.midonet.switchport.cluster.data.neutron.DeviceOwner;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.NetworkSegment;
import org.midonet.switchport.cluster.data.neutron.NeutronStore;
import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.cluster.data.neutron.Trunk;
import org.midonet.switchport.cluster.data.neutron.VifType;
import org.midonet.switchport.device.DeviceGateway;
import org.midonet.switchport.device.DeviceOperationException;
import org.midonet.switchport.driver.PortContext;
import org.midonet.switchport.inventory.PortMapping;
import org.midonet.switchport.topology.PortKind;
import org.midonet.switchport.topology.SwitchMeta;
import org.midonet.switchport.topology.TopologyResolver;

/**
 * Brings switch ports in line with the ports plugged into them.
 *
 * Every decision is taken on state read from the store while holding the
 * lock of the switch, never on the snapshot carried by the event: events
 * may arrive late, twice or out of order, and several nodes may handle
 * events for the same switch at once.
 *
 * Bare metal ports own their switch port, so it is configured with full
 * replace operations (access or trunk port) that converge whatever the
 * previous state was. Virtual machine ports share the uplink of their
 * compute host, so their VLAN is added to and removed from the uplink trunk
 * one at a time, and only removed when no other port still needs it.
 */
public class PortStateReconciler {

    private static final Logger log =
        LoggerFactory.getLogger(PortStateReconciler.class);

    private final NeutronStore store;
    private final DeviceGateway gateway;
    private final LockFactory lockFactory;
    private final TopologyResolver resolver;

    private final Counter deviceOperations;
    private final Counter deviceFailures;
    private final Counter staleDiscards;
    private final Counter sharedVlanSkips;

    @Inject
    public PortStateReconciler(NeutronStore store, DeviceGateway gateway,
                               LockFactory lockFactory,
                               TopologyResolver resolver,
                               MetricRegistry metrics) {
        this.store = store;
        this.gateway = gateway;
        this.lockFactory = lockFactory;
        this.resolver = resolver;
        Class<?> clazz = PortStateReconciler.class;
        this.deviceOperations =
            metrics.counter(MetricRegistry.name(clazz, "deviceOperations"));
        this.deviceFailures =
            metrics.counter(MetricRegistry.name(clazz, "deviceFailures"));
        this.staleDiscards =
            metrics.counter(MetricRegistry.name(clazz, "staleDiscards"));
        this.sharedVlanSkips =
            metrics.counter(MetricRegistry.name(clazz, "sharedVlanSkips"));
    }

    /**
     * Reconciles one switch port with a port event, under the lock of the
     * switch.
     *
     * @param port The port as carried by the event.
     * @param switchName The switch the port resolved to.
     * @param switchPort The switch port the port resolved to.
     * @param physnet Physical network of the port's network.
     * @param context Binding context, or null outside of port binding.
     * @param segmentationId The VLAN resolved for the port, may be null.
     * @param delete Whether the port is being deleted. Only relevant to
     *               virtual machine ports, whose deletion cannot be told
     *               from their state.
     */
    public void ensurePort(Port port, String switchName, String switchPort,
                           String physnet, PortContext context,
                           Integer segmentationId, boolean delete)
            throws MechanismDriverException, StateAccessException {
        log.debug("Ensuring state of port {} with mac {} on switch {} port {} "
                  + "physnet {}", port.id, port.macAddress, switchName,
                  switchPort, physnet);

        if (!gateway.hasHost(switchName)) {
            throw new UnknownSwitchException(switchName,
                "Could not find switch " + switchName + " in the inventory "
                + "while configuring port " + port.id);
        }

        try (ClusterLock lock = lockFactory.acquire(switchName)) {
            Port current = store.getPort(port.id);

            if (PortKind.of(port).isCompute()) {
                // The virtual side is plugged by Open vSwitch. All that is
                // managed here is the VLAN set of the compute host uplink.
                if (delete) {
                    removeUplinkVlan(port, switchName, switchPort,
                                     segmentationId);
                } else {
                    setPortState(current == null ? port : current,
                                 switchName, switchPort);
                }
                return;
            }

            if (current != null && current.hasLocalLinkInfo()) {
                setPortState(current, switchName, switchPort);
                if (context != null) {
                    List<NetworkSegment> segments = context.segmentsToBind();
                    if (segments != null && !segments.isEmpty()) {
                        context.setBinding(segments.get(0).id, VifType.OTHER,
                                           Collections.<String, Object>emptyMap());
                    }
                }
                return;
            }

            // The port is gone, or no longer carries link information, but
            // the switch port may still be configured for it.
            if (isDeletedPortInUse(physnet, port.macAddress)) {
                log.debug("Port {} was deleted, but its switch port {} is "
                          + "now in use by another port, discarding request "
                          + "to delete", port.id, switchPort);
                sharedVlanSkips.inc();
                return;
            }
            deleteSwitchPort(switchName, switchPort);
        }
    }

    /**
     * Configures a switch port for the current state of a port. A virtual
     * machine port gets its VLAN, and the VLANs of its sub-ports if it is a
     * trunk parent, added one by one to the uplink trunk of its host. Other
     * ports get a trunk port carrying every sub-port VLAN if they are a
     * trunk parent, or an access port.
     *
     * The caller is expected to hold the lock of the switch.
     */
    public void setPortState(Port port, String switchName, String switchPort)
            throws MechanismDriverException, StateAccessException {
        if (port == null) {
            throw new InvalidArgumentException(
                "Null port passed to setPortState");
        }
        if (Strings.isNullOrEmpty(switchName)
            || Strings.isNullOrEmpty(switchPort)) {
            throw new InvalidArgumentException(
                "Could not find switch name " + switchName + " or switch "
                + "port " + switchPort + " to set the state of port "
                + port.id);
        }
        if (!gateway.hasHost(switchName)) {
            throw new UnknownSwitchException(switchName);
        }

        Network network = store.getNetwork(port.networkId);
        if (network == null) {
            throw new NetworkNotFoundException(port.networkId, port.id);
        }
        NetworkSegment segment = network.primarySegment();
        if (segment == null || segment.segmentationId == null) {
            throw new InvalidArgumentException(
                "Network " + network.id + " of port " + port.id
                + " has no VLAN segment");
        }
        int vlan = segment.segmentationId;

        Trunk trunk = store.getTrunkByPortId(port.id);
        try {
            if (PortKind.of(port).isCompute()) {
                // Shared uplink: never replace the VLANs of other ports.
                deviceOperations.inc();
                gateway.addTrunkVlan(switchName, switchPort, vlan);
                if (trunk != null) {
                    for (Integer trunked : trunk.trunkedVlans()) {
                        deviceOperations.inc();
                        gateway.addTrunkVlan(switchName, switchPort, trunked);
                    }
                }
            } else if (trunk != null) {
                deviceOperations.inc();
                List<Integer> trunked = new ArrayList<>(trunk.trunkedVlans());
                gateway.confTrunkPort(switchName, switchPort, vlan, trunked);
            } else {
                deviceOperations.inc();
                gateway.confAccessPort(switchName, switchPort, vlan);
            }
        } catch (DeviceOperationException e) {
            deviceFailures.inc();
            log.error("Failed to plug port {} into switch port {} on device "
                      + "{}", port.id, switchPort, switchName, e);
            throw new DeviceConfigurationException(
                "Failed to plug port " + port.id + " into switch port "
                + switchPort + " on " + switchName, e);
        }
        log.info("Port {} has been plugged into switch port {} on device {}",
                 port.id, switchPort, switchName);
    }

    /**
     * Re-applies the state of a trunk parent port after its trunk or
     * sub-ports changed, on every switch port it resolves to.
     */
    public void ensureSubports(UUID portId)
            throws MechanismDriverException, StateAccessException {
        Port port = store.getPort(portId);
        // Deleting the parent port cleans up the switch port.
        if (port == null) {
            log.debug("Discarding attempt to ensure sub-ports of port {} "
                      + "which has been deleted", portId);
            staleDiscards.inc();
            return;
        }

        SwitchMeta meta = resolver.resolve(port, null);
        for (PortMapping mapping : meta.mappings) {
            if (!gateway.hasHost(mapping.switchName)) {
                throw new UnknownSwitchException(mapping.switchName);
            }
            try (ClusterLock lock = lockFactory.acquire(mapping.switchName)) {
                Port updated = store.getPort(portId);
                if (updated == null) {
                    log.debug("Discarding attempt to ensure sub-ports of "
                              + "port {} which was deleted after lock "
                              + "acquisition", portId);
                    staleDiscards.inc();
                    return;
                }
                setPortState(updated, mapping.switchName, mapping.switchPort);
            }
        }
    }

    private void removeUplinkVlan(Port port, String switchName,
                                  String switchPort, Integer segmentationId)
            throws MechanismDriverException, StateAccessException {
        if (segmentationId == null) {
            log.debug("Port {} has no segmentation id, nothing to remove "
                      + "from {} {}", port.id, switchName, switchPort);
            return;
        }

        List<Port> sharing = portsSharingUplink(port, switchName, switchPort,
                                                segmentationId);
        if (!sharing.isEmpty()) {
            log.info("Skip removing segmentation id {} from compute host {}. "
                     + "There are {} other active ports using the VLAN.",
                     segmentationId, port.hostId, sharing.size());
            sharedVlanSkips.inc();
            return;
        }

        try {
            deviceOperations.inc();
            gateway.deleteTrunkVlan(switchName, switchPort, segmentationId);
        } catch (DeviceOperationException e) {
            deviceFailures.inc();
            log.error("Failed to remove VLAN {} from switch port {} on device "
                      + "{}", segmentationId, switchPort, switchName, e);
            throw new DeviceConfigurationException(
                "Failed to remove VLAN " + segmentationId + " from switch "
                + "port " + switchPort + " on " + switchName, e);
        }
        log.info("Removed VLAN {} from switch port {} on device {}",
                 segmentationId, switchPort, switchName);
    }

    /**
     * The other virtual machine ports of the network that sit behind the
     * same switch port on the same VLAN.
     */
    private List<Port> portsSharingUplink(Port port, String switchName,
                                          String switchPort,
                                          int segmentationId)
            throws MechanismDriverException, StateAccessException {
        Network network = store.getNetwork(port.networkId);
        List<Port> sharing = new ArrayList<>();
        for (Port other : store.getPorts(port.networkId, DeviceOwner.COMPUTE)) {
            if (other.id.equals(port.id) || !PortKind.of(other).isCompute()) {
                continue;
            }
            SwitchMeta meta = resolver.resolve(other, network);
            if (meta.contains(switchName, switchPort)
                && meta.segmentationId != null
                && meta.segmentationId == segmentationId) {
                sharing.add(other);
            }
        }
        log.debug("Active ports sharing {} {} on VLAN {}: {}", switchName,
                  switchPort, segmentationId, sharing);
        return sharing;
    }

    /**
     * Whether another bound bare metal port with the given MAC sits on a
     * VLAN segment of the physical network, in which case the switch port
     * belongs to it now.
     */
    private boolean isDeletedPortInUse(String physnet, String mac)
            throws StateAccessException {
        if (mac == null) {
            return false;
        }
        List<Port> ports = store.getPortsByMac(mac);
        if (ports.size() > 1) {
            // Not a problem as such, but may indicate MAC spoofing.
            log.warn("Multiple ports match bare metal port mac {}", mac);
        }
        for (Port other : ports) {
            if (!other.hasHost() || !other.hasLocalLinkInfo()) {
                continue;
            }
            Network net = store.getNetwork(other.networkId);
            if (net == null) {
                continue;
            }
            for (NetworkSegment seg : net.segments) {
                if (seg.isVlan() && Objects.equal(seg.physicalNetwork, physnet)) {
                    return true;
                }
            }
        }
        return false;
    }

    private void deleteSwitchPort(String switchName, String switchPort)
            throws DeviceConfigurationException {
        log.debug("Unplugging port {} on {}", switchPort, switchName);
        try {
            deviceOperations.inc();
            gateway.deletePort(switchName, switchPort);
        } catch (DeviceOperationException e) {
            deviceFailures.inc();
            log.error("Failed to unplug port {} on {}", switchPort,
                      switchName, e);
            throw new DeviceConfigurationException(
                "Failed to unplug port " + switchPort + " on " + switchName,
                e);
        }
        log.info("Unplugged port {} on {}", switchPort, switchName);
    }
}
