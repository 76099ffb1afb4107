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

import java.util.UUID;

import org.junit.Test;

import org.midonet.switchport.cluster.data.neutron.DeviceOwner;
import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.cluster.data.neutron.VifType;
import org.midonet.switchport.cluster.data.neutron.VnicType;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class PortKindTest {

    private static Port port(DeviceOwner owner, VnicType vnic, VifType vif) {
        Port port = new Port(UUID.randomUUID(), UUID.randomUUID(), "mac");
        port.deviceOwner = owner;
        port.vnicType = vnic;
        port.vifType = vif;
        return port;
    }

    @Test
    public void testClassification() {
        assertThat(PortKind.of(port(DeviceOwner.BAREMETAL, VnicType.BAREMETAL,
                                    VifType.OTHER)),
                   is(PortKind.BAREMETAL));
        assertThat(PortKind.of(port(DeviceOwner.COMPUTE, VnicType.NORMAL,
                                    VifType.OVS)),
                   is(PortKind.COMPUTE));
        assertThat(PortKind.of(port(DeviceOwner.COMPUTE, VnicType.DIRECT,
                                    VifType.OVS)),
                   is(PortKind.COMPUTE_PASSTHROUGH));
        assertThat(PortKind.of(port(DeviceOwner.DHCP, VnicType.NORMAL,
                                    VifType.OVS)),
                   is(PortKind.UNMANAGED));
        assertThat(PortKind.of(null), is(PortKind.UNMANAGED));
        assertThat(PortKind.COMPUTE_PASSTHROUGH.isCompute(), is(true));
        assertThat(PortKind.BAREMETAL.isCompute(), is(false));
    }

    @Test
    public void testSupported() {
        assertThat(PortKind.isSupported(port(DeviceOwner.COMPUTE,
            VnicType.MACVTAP, VifType.OVS)), is(false));
        assertThat(PortKind.isSupported(port(DeviceOwner.COMPUTE,
            VnicType.DIRECT_PHYSICAL, VifType.OVS)), is(false));
        assertThat(PortKind.isSupported(port(DeviceOwner.COMPUTE,
            VnicType.DIRECT, VifType.OVS)), is(true));
        assertThat(PortKind.isSupported(null), is(false));
    }

    @Test
    public void testBound() {
        assertThat(PortKind.isBound(port(DeviceOwner.BAREMETAL,
            VnicType.BAREMETAL, VifType.OTHER)), is(true));
        assertThat(PortKind.isBound(port(DeviceOwner.BAREMETAL,
            VnicType.BAREMETAL, VifType.UNBOUND)), is(false));
        assertThat(PortKind.isBound(port(DeviceOwner.COMPUTE,
            VnicType.NORMAL, VifType.OVS)), is(true));
        assertThat(PortKind.isBound(port(DeviceOwner.COMPUTE,
            VnicType.NORMAL, VifType.OTHER)), is(false));
        assertThat(PortKind.isBound(port(DeviceOwner.DHCP,
            VnicType.NORMAL, VifType.OVS)), is(false));
        assertThat(PortKind.isBound(port(DeviceOwner.COMPUTE,
            VnicType.MACVTAP, VifType.OVS)), is(false));
    }
}
