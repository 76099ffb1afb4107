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
package org.midonet.switchport.topology;

import java.util.Arrays;
import java.util.UUID;

import org.junit.Before;
import org.junit.Test;

import org.midonet.switchport.LocalLinkInfoMissingException;
import org.midonet.switchport.NeutronFixtures;
import org.midonet.switchport.cluster.data.neutron.DeviceOwner;
import org.midonet.switchport.cluster.data.neutron.MockNeutronStore;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.cluster.data.neutron.VifType;
import org.midonet.switchport.inventory.PortMapping;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class TopologyResolverTest {

    private TopologyResolver resolver;
    private Network net;

    @Before
    public void setUp() {
        resolver = new TopologyResolver(NeutronFixtures.inventory());
        net = NeutronFixtures.vlanNetwork(new MockNeutronStore(), 100,
                                          NeutronFixtures.PHYSNET);
    }

    @Test
    public void testBaremetalByName() throws Exception {
        Port port = NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1");
        SwitchMeta meta = resolver.resolve(port, net);
        assertThat(meta.mappings, equalTo(
            Arrays.asList(new PortMapping("sw2", "Eth1/1"))));
        assertThat(meta.segmentationId, is(100));
    }

    @Test
    public void testBaremetalByMac() throws Exception {
        Port port = NeutronFixtures.baremetalPort(net, null,
                                                  "aa:bb:cc:dd:ee:ff",
                                                  "Eth1/2");
        SwitchMeta meta = resolver.resolve(port, null);
        assertThat(meta.mappings, equalTo(
            Arrays.asList(new PortMapping("sw2", "Eth1/2"))));
        assertThat(meta.segmentationId, nullValue());
    }

    @Test
    public void testExplicitNameWinsOverMac() throws Exception {
        Port port = NeutronFixtures.baremetalPort(net, "sw1",
                                                  "aa:bb:cc:dd:ee:ff",
                                                  "Eth1/3");
        assertThat(resolver.resolve(port, net).mappings.get(0).switchName,
                   is("sw1"));
    }

    @Test(expected = LocalLinkInfoMissingException.class)
    public void testBaremetalWithoutLinkInfo() throws Exception {
        Port port = NeutronFixtures.baremetalPort(net, "sw2", null, "Eth1/1");
        port.profile.remove(Port.LOCAL_LINK_INFORMATION);
        // Everything else about the port is in order.
        port.profile.put(Port.PCI_SLOT, "0000:03:00.1");
        port.hostId = "compute-1";
        port.deviceOwner = DeviceOwner.COMPUTE;
        port.vifType = VifType.OTHER;
        resolver.resolve(port, net);
    }

    @Test
    public void testComputeByHostId() throws Exception {
        Port port = NeutronFixtures.computePort(net, "compute-1");
        SwitchMeta meta = resolver.resolve(port, net);
        assertThat(meta.mappings, equalTo(
            Arrays.asList(new PortMapping("sw1", "xe-0/0/1"))));
        assertThat(meta.segmentationId, is(100));
    }

    @Test
    public void testUnmappedHostIsNotAnError() throws Exception {
        Port port = NeutronFixtures.computePort(net, "compute-9");
        SwitchMeta meta = resolver.resolve(port, net);
        assertThat(meta.isEmpty(), is(true));
        assertThat(meta.segmentationId, is(100));

        port.hostId = null;
        assertThat(resolver.resolve(port, net).isEmpty(), is(true));
    }

    @Test
    public void testPassthroughPortsAreKeyedByPciFunction() throws Exception {
        Port first = NeutronFixtures.passthroughPort(net, "compute-2",
                                                     "0000:03:00.1");
        Port second = NeutronFixtures.passthroughPort(net, "compute-2",
                                                      "0000:04:00.0");

        assertThat(resolver.passthroughHostId(first), is("compute-2-0300"));
        assertThat(resolver.passthroughHostId(second), is("compute-2-0400"));
        assertThat(resolver.passthroughHostId(first),
                   not(equalTo(resolver.passthroughHostId(second))));

        assertThat(resolver.resolve(first, net).mappings, equalTo(
            Arrays.asList(new PortMapping("sw1", "xe-0/0/2"))));
        assertThat(resolver.resolve(second, net).mappings, equalTo(
            Arrays.asList(new PortMapping("sw1", "xe-0/0/3"))));
    }

    @Test
    public void testPassthroughPortWithoutPciSlot() throws Exception {
        Port port = NeutronFixtures.passthroughPort(net, "compute-1", null);
        port.profile.remove(Port.PCI_SLOT);
        assertThat(resolver.passthroughHostId(port), is("compute-1"));
    }

    @Test
    public void testUnmanagedPortResolvesToNothing() throws Exception {
        Port port = new Port(UUID.randomUUID(), net.id, "mac");
        port.deviceOwner = DeviceOwner.DHCP;
        port.hostId = "compute-1";
        assertThat(resolver.resolve(port, net), is(SwitchMeta.EMPTY));
    }
}
