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
package org.midonet.switchport.driver;

import java.util.Arrays;
import java.util.Collections;
import java.util.UUID;

import com.codahale.metrics.MetricRegistry;
import org.junit.Before;
import org.junit.Test;

import org.midonet.switchport.LocalLinkInfoMissingException;
import org.midonet.switchport.NeutronFixtures;
import org.midonet.switchport.cluster.LocalLockFactory;
import org.midonet.switchport.cluster.data.neutron.MockNeutronStore;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.cluster.data.neutron.SubPort;
import org.midonet.switchport.cluster.data.neutron.Trunk;
import org.midonet.switchport.cluster.data.neutron.VifType;
import org.midonet.switchport.cluster.data.neutron.VnicType;
import org.midonet.switchport.device.LoggingDeviceGateway;
import org.midonet.switchport.inventory.SwitchInventory;
import org.midonet.switchport.state.NetworkLifecycleHandler;
import org.midonet.switchport.state.PortStateReconciler;
import org.midonet.switchport.topology.TopologyResolver;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SwitchPortMechanismDriverTest {

    private static final String DRIVER = SwitchPortMechanismDriver
        .PROVISIONING_ENTITY;

    private MockNeutronStore store;
    private LoggingDeviceGateway gateway;
    private SwitchPortMechanismDriver driver;
    private TrunkHandler trunkHandler;

    @Before
    public void setUp() {
        SwitchInventory inventory = NeutronFixtures.inventory();
        store = new MockNeutronStore();
        gateway = spy(new LoggingDeviceGateway(inventory));
        LocalLockFactory locks = new LocalLockFactory();
        MetricRegistry metrics = new MetricRegistry();
        TopologyResolver resolver = new TopologyResolver(inventory);
        PortStateReconciler reconciler = new PortStateReconciler(
            store, gateway, locks, resolver, metrics);
        NetworkLifecycleHandler networkHandler = new NetworkLifecycleHandler(
            store, inventory, gateway, locks, metrics);
        driver = new SwitchPortMechanismDriver(store, resolver, reconciler,
                                               networkHandler);
        trunkHandler = new TrunkHandler(reconciler);
    }

    private static NetworkContext networkContext(Network network) {
        NetworkContext context = mock(NetworkContext.class);
        when(context.current()).thenReturn(network);
        return context;
    }

    private static PortContext portContext(Port current, Port original,
                                           Network network) {
        PortContext context = mock(PortContext.class);
        NetworkContext netContext = networkContext(network);
        when(context.current()).thenReturn(current);
        when(context.original()).thenReturn(original);
        when(context.network()).thenReturn(netContext);
        when(context.segmentsToBind()).thenReturn(network.segments);
        return context;
    }

    @Test
    public void testBaremetalPortThenSubPortEndToEnd() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 50,
                                                  NeutronFixtures.PHYSNET);
        Port port = NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1");
        port.vifType = VifType.UNBOUND;
        store.createPort(port);

        PortContext binding = portContext(port, null, net);
        driver.bindPort(binding);
        verify(gateway).confAccessPort("sw2", "Eth1/1", 50);
        verify(binding).setBinding(net.segments.get(0).id, VifType.OTHER,
                                   Collections.<String, Object>emptyMap());
        assertThat(store.getProvisioningComponents(port.id).contains(DRIVER),
                   is(true));

        Port bound = store.getPort(port.id);
        bound.vifType = VifType.OTHER;
        store.updatePort(bound);
        driver.updatePortPostcommit(portContext(bound, port, net));
        assertThat(store.isProvisioningComplete(port.id, DRIVER), is(true));

        Trunk trunk = store.createTrunk(new Trunk(UUID.randomUUID(), port.id));
        SubPort sub = new SubPort(UUID.randomUUID(), 60);
        store.addSubPort(trunk.id, sub);
        trunkHandler.onSubPortsAdded(store.getTrunkByPortId(port.id),
                                     Arrays.asList(sub));
        verify(gateway).confTrunkPort("sw2", "Eth1/1", 50, Arrays.asList(60));
    }

    @Test
    public void testBindComputePort() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = store.createPort(
            NeutronFixtures.computePort(net, "compute-1"));

        PortContext context = portContext(port, null, net);
        driver.bindPort(context);
        verify(gateway).addTrunkVlan("sw1", "xe-0/0/1", 100);
        verify(context, never()).setBinding(any(UUID.class),
                                            any(VifType.class), anyMap());
    }

    @Test
    public void testBindUnsupportedPortIsIgnored() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = NeutronFixtures.computePort(net, "compute-1");
        port.vnicType = VnicType.MACVTAP;
        store.createPort(port);

        driver.bindPort(portContext(port, null, net));
        assertThat(gateway.getRequests().isEmpty(), is(true));
        assertThat(store.getProvisioningComponents(port.id).isEmpty(),
                   is(true));
    }

    @Test(expected = LocalLinkInfoMissingException.class)
    public void testBindBaremetalPortWithoutLinkInfo() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1");
        port.profile.clear();
        store.createPort(port);

        driver.bindPort(portContext(port, null, net));
    }

    @Test
    public void testUpdateComputePort() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = store.createPort(
            NeutronFixtures.computePort(net, "compute-1"));

        driver.updatePortPostcommit(portContext(port, port, net));
        verify(gateway).addTrunkVlan("sw1", "xe-0/0/1", 100);
    }

    @Test
    public void testUpdateUnboundPortUnplugsSwitchPort() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port original = store.createPort(
            NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1"));
        Port unbound = original.copy();
        unbound.vifType = VifType.UNBOUND;
        unbound.hostId = null;
        unbound.profile.clear();
        store.updatePort(unbound);

        driver.updatePortPostcommit(portContext(unbound, original, net));
        verify(gateway).deletePort("sw2", "Eth1/1");
    }

    @Test
    public void testUpdateOfUnboundPortIsIgnored() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1");
        port.vifType = VifType.UNBOUND;
        store.createPort(port);

        driver.updatePortPostcommit(portContext(port, port, net));
        assertThat(gateway.getRequests().isEmpty(), is(true));
        assertThat(store.isProvisioningComplete(port.id, DRIVER), is(false));
    }

    @Test
    public void testDeleteBoundBaremetalPort() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1");

        driver.deletePortPostcommit(portContext(port, null, net));
        verify(gateway).deletePort("sw2", "Eth1/1");
    }

    @Test
    public void testDeleteLastComputePortRemovesVlan() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = NeutronFixtures.computePort(net, "compute-1");

        driver.deletePortPostcommit(portContext(port, null, net));
        verify(gateway).deleteTrunkVlan("sw1", "xe-0/0/1", 100);
    }

    @Test
    public void testDeleteUnboundPortIsIgnored() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);
        Port port = NeutronFixtures.computePort(net, "compute-1");
        port.vifType = VifType.BINDING_FAILED;

        driver.deletePortPostcommit(portContext(port, null, net));
        verify(gateway, never()).deleteTrunkVlan(anyString(), anyString(),
                                                 anyInt());
    }

    @Test
    public void testNetworkHooks() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                  NeutronFixtures.PHYSNET);

        driver.createNetworkPostcommit(networkContext(net));
        verify(gateway).createVlan("sw1", 100);

        store.deleteNetwork(net.id);
        driver.deleteNetworkPostcommit(networkContext(net));
        verify(gateway).deleteVlan("sw1", 100);
    }

    @Test
    public void testTrunkDeletedRevertsToAccessPort() throws Exception {
        Network net = NeutronFixtures.vlanNetwork(store, 50,
                                                  NeutronFixtures.PHYSNET);
        Port port = store.createPort(
            NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1"));
        Trunk trunk = store.createTrunk(new Trunk(UUID.randomUUID(), port.id));
        store.addSubPort(trunk.id, new SubPort(UUID.randomUUID(), 60));

        trunkHandler.onTrunkCreated(store.getTrunkByPortId(port.id));
        verify(gateway).confTrunkPort("sw2", "Eth1/1", 50, Arrays.asList(60));

        store.deleteTrunk(trunk.id);
        trunkHandler.onTrunkDeleted(trunk);
        verify(gateway).confAccessPort("sw2", "Eth1/1", 50);
    }
}
