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

import java.util.List;

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.MechanismDriverException;
import org.midonet.switchport.cluster.StateAccessException;
import org.midonet.switchport.cluster.data.neutron.SubPort;
import org.midonet.switchport.cluster.data.neutron.Trunk;
import org.midonet.switchport.state.PortStateReconciler;

/**
 * Trunk events. Whatever changed, the parent port's switch port is
 * reconfigured from the current trunk, so events can be handled in any
 * order.
 */
public class TrunkHandler {

    private static final Logger log =
        LoggerFactory.getLogger(TrunkHandler.class);

    private final PortStateReconciler reconciler;

    @Inject
    public TrunkHandler(PortStateReconciler reconciler) {
        this.reconciler = reconciler;
    }

    public void onTrunkCreated(Trunk trunk)
            throws MechanismDriverException, StateAccessException {
        log.debug("Trunk {} created on port {}", trunk.id, trunk.portId);
        reconciler.ensureSubports(trunk.portId);
    }

    public void onTrunkDeleted(Trunk trunk)
            throws MechanismDriverException, StateAccessException {
        log.debug("Trunk {} deleted from port {}", trunk.id, trunk.portId);
        reconciler.ensureSubports(trunk.portId);
    }

    public void onSubPortsAdded(Trunk trunk, List<SubPort> subPorts)
            throws MechanismDriverException, StateAccessException {
        log.debug("Sub-ports {} added to trunk {}", subPorts, trunk.id);
        reconciler.ensureSubports(trunk.portId);
    }

    public void onSubPortsRemoved(Trunk trunk, List<SubPort> subPorts)
            throws MechanismDriverException, StateAccessException {
        log.debug("Sub-ports {} removed from trunk {}", subPorts, trunk.id);
        reconciler.ensureSubports(trunk.portId);
    }
}
