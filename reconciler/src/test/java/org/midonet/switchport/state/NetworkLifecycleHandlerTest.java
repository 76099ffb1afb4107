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

import java.util.UUID;

import com.codahale.metrics.MetricRegistry;
import org.junit.Before;
import org.junit.Test;

import org.midonet.switchport.DeviceConfigurationException;
import org.midonet.switchport.NeutronFixtures;
import org.midonet.switchport.cluster.LocalLockFactory;
import org.midonet.switchport.cluster.LockFactory;
import org.midonet.switchport.cluster.data.neutron.MockNeutronStore;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.NetworkSegment;
import org.midonet.switchport.device.DeviceOperationException;
import org.midonet.switchport.device.LoggingDeviceGateway;
import org.midonet.switchport.inventory.SwitchInventory;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class NetworkLifecycleHandlerTest {

    private static final String PHYSNET = NeutronFixtures.PHYSNET;

    private SwitchInventory inventory;
    private MockNeutronStore store;
    private LoggingDeviceGateway gateway;
    private LocalLockFactory locks;
    private MetricRegistry metrics;
    private NetworkLifecycleHandler handler;

    @Before
    public void setUp() {
        inventory = NeutronFixtures.inventory();
        store = new MockNeutronStore();
        gateway = spy(new LoggingDeviceGateway(inventory));
        locks = new LocalLockFactory();
        metrics = new MetricRegistry();
        handler = newHandler(locks);
    }

    private NetworkLifecycleHandler newHandler(LockFactory lockFactory) {
        return new NetworkLifecycleHandler(store, inventory, gateway,
                                           lockFactory, metrics);
    }

    private long staleDiscards() {
        return metrics.counter(MetricRegistry.name(
            NetworkLifecycleHandler.class, "staleDiscards")).getCount();
    }

    @Test
    public void testNetworkLifecycleEndToEnd() throws Exception {
        Network n1 = NeutronFixtures.vlanNetwork(store, 100, PHYSNET);

        handler.onNetworkCreate(n1);
        verify(gateway, times(1)).createVlan("sw1", 100);
        verify(gateway, times(1)).createVlan("sw2", 100);
        verify(gateway, never()).createVlan("sw3", 100);

        store.deleteNetwork(n1.id);
        handler.onNetworkDelete(n1);
        verify(gateway, times(1)).deleteVlan("sw1", 100);
        verify(gateway, times(1)).deleteVlan("sw2", 100);
        verify(gateway, never()).deleteVlan("sw3", 100);
        assertThat(gateway.getRequests().size(), is(4));
        assertThat(locks.isLocked("sw1"), is(false));
    }

    @Test
    public void testCreateSkippedWhenSegmentRemovedBeforeLockGrant()
            throws Exception {
        final Network n1 = NeutronFixtures.vlanNetwork(store, 100, PHYSNET);
        final UUID segmentId = n1.segments.get(0).id;
        LockFactory racing = name -> {
            store.deleteSegment(segmentId);
            return locks.acquire(name);
        };

        newHandler(racing).onNetworkCreate(n1);
        verify(gateway, never()).createVlan(anyString(), anyInt());
        assertThat(staleDiscards(), is(1L));
    }

    @Test
    public void testCreateSkippedWhenNetworkDeletedBeforeLockGrant()
            throws Exception {
        final Network n1 = NeutronFixtures.vlanNetwork(store, 100, PHYSNET);
        LockFactory racing = name -> {
            store.deleteNetwork(n1.id);
            return locks.acquire(name);
        };

        newHandler(racing).onNetworkCreate(n1);
        verify(gateway, never()).createVlan(anyString(), anyInt());
    }

    @Test
    public void testDeleteSkippedWhenVlanRecreated() throws Exception {
        Network n1 = NeutronFixtures.vlanNetwork(store, 100, PHYSNET);
        store.deleteNetwork(n1.id);
        NeutronFixtures.vlanNetwork(store, 100, PHYSNET);

        handler.onNetworkDelete(n1);
        verify(gateway, never()).deleteVlan(anyString(), anyInt());
        assertThat(staleDiscards(), is(1L));
    }

    @Test
    public void testDeleteWhenVlanReusedOnOtherPhysnet() throws Exception {
        Network n1 = NeutronFixtures.vlanNetwork(store, 100, PHYSNET);
        store.deleteNetwork(n1.id);
        NeutronFixtures.vlanNetwork(store, 100, "physnet2");
        Network vxlan = new Network(UUID.randomUUID(), "overlay");
        vxlan.segments.add(new NetworkSegment(UUID.randomUUID(), vxlan.id,
                                              NetworkSegment.TYPE_VXLAN, 100,
                                              null));
        store.createNetwork(vxlan);

        handler.onNetworkDelete(n1);
        verify(gateway).deleteVlan("sw1", 100);
        verify(gateway).deleteVlan("sw2", 100);
    }

    @Test
    public void testNonVlanNetworksAreIgnored() throws Exception {
        Network flat = new Network(UUID.randomUUID(), "flat");
        flat.segments.add(new NetworkSegment(UUID.randomUUID(), flat.id,
                                             NetworkSegment.TYPE_FLAT, null,
                                             PHYSNET));
        store.createNetwork(flat);
        Network noSegment = store.createNetwork(
            new Network(UUID.randomUUID(), "empty"));

        handler.onNetworkCreate(flat);
        handler.onNetworkCreate(noSegment);
        handler.onNetworkDelete(flat);
        assertThat(gateway.getRequests().isEmpty(), is(true));
    }

    @Test
    public void testDeviceFailureAbortsCreate() throws Exception {
        Network n1 = NeutronFixtures.vlanNetwork(store, 100, PHYSNET);
        doThrow(new DeviceOperationException(null, "vlan range exhausted"))
            .when(gateway).createVlan("sw1", 100);

        try {
            handler.onNetworkCreate(n1);
            fail("Device failure was not reported");
        } catch (DeviceConfigurationException e) {
            assertThat(e.getCause().getMessage(), is("vlan range exhausted"));
        }
        // Switches are handled in name order, sw2 is never reached.
        verify(gateway, never()).createVlan("sw2", 100);
        assertThat(locks.isLocked("sw1"), is(false));
    }
}
