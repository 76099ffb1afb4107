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
package org.midonet.switchport.cluster.data.neutron;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableSet;

/**
 * In-memory control plane store. Objects are copied in and out, so callers
 * holding a returned object see a snapshot, as they would with a remote
 * store.
 */
public class MockNeutronStore implements NeutronStore {

    private final Map<UUID, Network> networks = new LinkedHashMap<>();
    private final Map<UUID, Port> ports = new LinkedHashMap<>();
    private final Map<UUID, Trunk> trunks = new LinkedHashMap<>();
    private final Map<UUID, Set<String>> provisioning = new HashMap<>();
    private final Map<UUID, Set<String>> provisioned = new HashMap<>();

    @Override
    public synchronized Port getPort(@Nonnull UUID id) {
        Port port = ports.get(id);
        return port == null ? null : port.copy();
    }

    @Override
    public synchronized List<Port> getPorts(@Nonnull UUID networkId,
                                            @Nonnull DeviceOwner owner) {
        List<Port> result = new ArrayList<>();
        for (Port port : ports.values()) {
            if (networkId.equals(port.networkId) && owner == port.deviceOwner) {
                result.add(port.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized List<Port> getPortsByMac(@Nonnull String macAddress) {
        List<Port> result = new ArrayList<>();
        for (Port port : ports.values()) {
            if (macAddress.equalsIgnoreCase(port.macAddress)) {
                result.add(port.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized Network getNetwork(@Nonnull UUID id) {
        Network net = networks.get(id);
        return net == null ? null : net.copy();
    }

    @Override
    public synchronized List<NetworkSegment> getSegments(int segmentationId) {
        List<NetworkSegment> result = new ArrayList<>();
        for (Network net : networks.values()) {
            for (NetworkSegment seg : net.copy().segments) {
                if (seg.segmentationId != null
                    && seg.segmentationId == segmentationId) {
                    result.add(seg);
                }
            }
        }
        return result;
    }

    @Override
    public synchronized Trunk getTrunkByPortId(@Nonnull UUID portId) {
        for (Trunk trunk : trunks.values()) {
            if (portId.equals(trunk.portId)) {
                return trunk.copy();
            }
        }
        return null;
    }

    @Override
    public synchronized void addProvisioningComponent(@Nonnull UUID portId,
                                                      @Nonnull String entity) {
        provisioning.computeIfAbsent(portId, id -> new HashSet<>()).add(entity);
    }

    @Override
    public synchronized void provisioningComplete(@Nonnull UUID portId,
                                                  @Nonnull String entity) {
        Set<String> pending = provisioning.get(portId);
        if (pending != null) {
            pending.remove(entity);
        }
        provisioned.computeIfAbsent(portId, id -> new HashSet<>()).add(entity);
    }

    /**
     * @return The entities still blocking the provisioning of a port.
     */
    public synchronized Set<String> getProvisioningComponents(UUID portId) {
        Set<String> pending = provisioning.get(portId);
        return pending == null ? ImmutableSet.<String>of()
                               : ImmutableSet.copyOf(pending);
    }

    public synchronized boolean isProvisioningComplete(UUID portId,
                                                       String entity) {
        Set<String> done = provisioned.get(portId);
        return done != null && done.contains(entity);
    }

    public synchronized Network createNetwork(@Nonnull Network network) {
        Network stored = network.copy();
        for (NetworkSegment seg : stored.segments) {
            seg.networkId = stored.id;
        }
        networks.put(stored.id, stored);
        return stored.copy();
    }

    public synchronized Network updateNetwork(@Nonnull Network network) {
        if (!networks.containsKey(network.id)) {
            throw new IllegalArgumentException("No such network " + network.id);
        }
        return createNetwork(network);
    }

    public synchronized void deleteNetwork(@Nonnull UUID id) {
        networks.remove(id);
    }

    public synchronized void addSegment(@Nonnull UUID networkId,
                                        @Nonnull NetworkSegment segment) {
        Network net = networks.get(networkId);
        if (net == null) {
            throw new IllegalArgumentException("No such network " + networkId);
        }
        segment.networkId = networkId;
        net.segments.add(new NetworkSegment(segment.id, networkId,
                                            segment.networkType,
                                            segment.segmentationId,
                                            segment.physicalNetwork));
    }

    public synchronized void deleteSegment(@Nonnull UUID segmentId) {
        for (Network net : networks.values()) {
            Iterator<NetworkSegment> it = net.segments.iterator();
            while (it.hasNext()) {
                if (segmentId.equals(it.next().id)) {
                    it.remove();
                }
            }
        }
    }

    public synchronized Port createPort(@Nonnull Port port) {
        ports.put(port.id, port.copy());
        return port.copy();
    }

    public synchronized Port updatePort(@Nonnull Port port) {
        if (!ports.containsKey(port.id)) {
            throw new IllegalArgumentException("No such port " + port.id);
        }
        return createPort(port);
    }

    public synchronized void deletePort(@Nonnull UUID id) {
        ports.remove(id);
    }

    public synchronized Trunk createTrunk(@Nonnull Trunk trunk) {
        trunks.put(trunk.id, trunk.copy());
        return trunk.copy();
    }

    public synchronized void deleteTrunk(@Nonnull UUID id) {
        trunks.remove(id);
    }

    public synchronized void addSubPort(@Nonnull UUID trunkId,
                                        @Nonnull SubPort subPort) {
        Trunk trunk = trunks.get(trunkId);
        if (trunk == null) {
            throw new IllegalArgumentException("No such trunk " + trunkId);
        }
        SubPort copy = new SubPort(subPort.portId, subPort.segmentationId);
        copy.segmentationType = subPort.segmentationType;
        trunk.subPorts.add(copy);
    }

    public synchronized void removeSubPort(@Nonnull UUID trunkId,
                                           @Nonnull UUID subPortId) {
        Trunk trunk = trunks.get(trunkId);
        if (trunk == null) {
            return;
        }
        Iterator<SubPort> it = trunk.subPorts.iterator();
        while (it.hasNext()) {
            if (subPortId.equals(it.next().portId)) {
                it.remove();
            }
        }
    }
}
