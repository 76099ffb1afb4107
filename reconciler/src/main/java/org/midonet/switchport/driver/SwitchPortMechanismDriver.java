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

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.MechanismDriverException;
import org.midonet.switchport.cluster.StateAccessException;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.NeutronStore;
import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.inventory.PortMapping;
import org.midonet.switchport.state.NetworkLifecycleHandler;
import org.midonet.switchport.state.PortStateReconciler;
import org.midonet.switchport.topology.PortKind;
import org.midonet.switchport.topology.SwitchMeta;
import org.midonet.switchport.topology.TopologyResolver;

/**
 * The hooks the plugin framework calls on network and port events. A hook
 * that throws fails the event, which the framework then rolls back or
 * rejects.
 */
public class SwitchPortMechanismDriver {

    private static final Logger log =
        LoggerFactory.getLogger(SwitchPortMechanismDriver.class);

    /** Name under which this driver blocks port provisioning. */
    public static final String PROVISIONING_ENTITY = "SWITCHPORT";

    private final NeutronStore store;
    private final TopologyResolver resolver;
    private final PortStateReconciler reconciler;
    private final NetworkLifecycleHandler networkHandler;

    @Inject
    public SwitchPortMechanismDriver(NeutronStore store,
                                     TopologyResolver resolver,
                                     PortStateReconciler reconciler,
                                     NetworkLifecycleHandler networkHandler) {
        this.store = store;
        this.resolver = resolver;
        this.reconciler = reconciler;
        this.networkHandler = networkHandler;
    }

    public void createNetworkPostcommit(NetworkContext context)
            throws MechanismDriverException, StateAccessException {
        networkHandler.onNetworkCreate(context.current());
    }

    public void deleteNetworkPostcommit(NetworkContext context)
            throws MechanismDriverException, StateAccessException {
        networkHandler.onNetworkDelete(context.current());
    }

    /**
     * Virtual machine ports are reconciled on every update. Bound bare
     * metal ports were configured when bound, so their provisioning is just
     * marked complete. A port that lost its binding is reconciled from its
     * previous state, which unplugs its switch port.
     */
    public void updatePortPostcommit(PortContext context)
            throws MechanismDriverException, StateAccessException {
        Port port = context.current();
        if (PortKind.of(port).isCompute()) {
            ensurePort(port, context, false, "Ensuring updated");
        } else if (PortKind.isBound(port)) {
            store.provisioningComplete(port.id, PROVISIONING_ENTITY);
        } else if (PortKind.isBound(context.original())) {
            ensurePort(context.original(), context, false,
                       "Ensuring updated");
        }
    }

    public void deletePortPostcommit(PortContext context)
            throws MechanismDriverException, StateAccessException {
        Port port = context.current();
        if (PortKind.isBound(port)) {
            ensurePort(port, context, true, "Ensuring deleted");
        }
    }

    /**
     * Binds a port by configuring its switch ports. Bare metal ports get
     * their binding committed once their switch port is configured.
     */
    public void bindPort(PortContext context)
            throws MechanismDriverException, StateAccessException {
        Port port = context.current();
        // Checked before resolving, which fails on unsupported bare metal
        // ports.
        if (!PortKind.isSupported(port)) {
            log.warn("Port {} has vnic_type: {} which is not supported, "
                     + "ignoring.", port.id, port.vnicType);
            return;
        }

        Network network = networkOf(context);
        SwitchMeta meta = resolver.resolve(port, network);
        for (PortMapping mapping : meta.mappings) {
            log.debug("Plugging in port {} on {} to VLAN {}",
                      mapping.switchPort, mapping.switchName,
                      meta.segmentationId);
            store.addProvisioningComponent(port.id, PROVISIONING_ENTITY);
            reconciler.ensurePort(port, mapping.switchName,
                                  mapping.switchPort, physnetOf(network),
                                  context, meta.segmentationId, false);
        }
    }

    private void ensurePort(Port port, PortContext context, boolean delete,
                            String what)
            throws MechanismDriverException, StateAccessException {
        Network network = networkOf(context);
        SwitchMeta meta = resolver.resolve(port, network);
        for (PortMapping mapping : meta.mappings) {
            log.debug("{} port {} on {} {} to VLAN {}", what, port.id,
                      mapping.switchName, mapping.switchPort,
                      meta.segmentationId);
            reconciler.ensurePort(port, mapping.switchName,
                                  mapping.switchPort, physnetOf(network),
                                  context, meta.segmentationId, delete);
        }
    }

    private static Network networkOf(PortContext context) {
        return context.network() == null ? null
                                         : context.network().current();
    }

    private static String physnetOf(Network network) {
        return network == null ? null : network.physicalNetwork();
    }
}
