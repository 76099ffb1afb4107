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

import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.LocalLinkInfoMissingException;
import org.midonet.switchport.cluster.data.neutron.LocalLinkInfo;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.inventory.PortMapping;
import org.midonet.switchport.inventory.SwitchInventory;

/**
 * Locates ports on the physical network. Bare metal ports carry their
 * location in the link information of their binding profile. Virtual
 * machine ports are looked up in the inventory by the host they are bound
 * to, and by PCI address as well for passthrough ports.
 */
public class TopologyResolver {

    private static final Logger log =
        LoggerFactory.getLogger(TopologyResolver.class);

    private static final String PCI_DOMAIN = "0000:";

    private final SwitchInventory inventory;

    @Inject
    public TopologyResolver(SwitchInventory inventory) {
        this.inventory = inventory;
    }

    /**
     * Resolves the switch ports of a port.
     *
     * @param port The port to locate.
     * @param network The network of the port. May be null, in which case
     *                the result carries no segmentation id.
     * @return The switch ports, exactly one for bare metal ports and any
     *         number for virtual machine ports, none for other ports.
     * @throws LocalLinkInfoMissingException if a bare metal port has no
     *         link information.
     */
    public SwitchMeta resolve(Port port, Network network)
            throws LocalLinkInfoMissingException {
        Integer segmentationId =
            network == null ? null : network.segmentationId();
        switch (PortKind.of(port)) {
            case BAREMETAL:
                return new SwitchMeta(ImmutableList.of(fromLinkInfo(port)),
                                      segmentationId);
            case COMPUTE:
            case COMPUTE_PASSTHROUGH:
                return new SwitchMeta(fromHostId(port), segmentationId);
            default:
                return SwitchMeta.EMPTY;
        }
    }

    private PortMapping fromLinkInfo(Port port)
            throws LocalLinkInfoMissingException {
        LocalLinkInfo lli = port.firstLocalLinkInfo();
        if (lli == null) {
            log.debug("local_link_information is missing in port {} "
                      + "binding:profile", port.id);
            throw new LocalLinkInfoMissingException(port.id);
        }
        String switchName = lli.switchInfo;
        // Introspection only reports the MAC of the switch.
        if (Strings.isNullOrEmpty(switchName)) {
            switchName = inventory.switchForMac(lli.switchId);
        }
        log.debug("Local link info of port {}: name {} mac {} port {}",
                  port.id, switchName, lli.switchId, lli.portId);
        return new PortMapping(switchName, lli.portId);
    }

    private List<PortMapping> fromHostId(Port port) {
        String hostId = PortKind.of(port) == PortKind.COMPUTE_PASSTHROUGH
                        ? passthroughHostId(port) : port.hostId;
        log.debug("Host id lookup of port {}: {}", port.id, hostId);
        return inventory.portMappings(hostId);
    }

    /**
     * The mapping key of a passthrough port: its host id followed by the
     * bus and slot of its PCI function, so "0000:03:00.1" on host "c1"
     * gives "c1-0300". A port without a PCI slot is keyed by host id alone.
     */
    public String passthroughHostId(Port port) {
        String pciSlot = port.pciSlot();
        if (Strings.isNullOrEmpty(pciSlot) || port.hostId == null) {
            log.debug("Port {} has no PCI slot, using host id {}",
                      port.id, port.hostId);
            return port.hostId;
        }
        String device = pciSlot.split("\\.")[0]
                               .replace(PCI_DOMAIN, "")
                               .replace(":", "");
        return port.hostId + "-" + device;
    }
}
