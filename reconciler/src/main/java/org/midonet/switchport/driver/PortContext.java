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
import java.util.Map;
import java.util.UUID;

import org.midonet.switchport.cluster.data.neutron.NetworkSegment;
import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.cluster.data.neutron.VifType;

/**
 * The port an event is about, as handed over by the plugin framework.
 */
public interface PortContext {

    /**
     * The port as of the event.
     */
    Port current();

    /**
     * The port before an update, or null for other events.
     */
    Port original();

    NetworkContext network();

    /**
     * The segments this driver may bind the port to. Only non-empty while
     * a binding is being attempted.
     */
    List<NetworkSegment> segmentsToBind();

    /**
     * The host the port is being bound to.
     */
    String host();

    /**
     * Completes the binding of the port. The framework may still discard
     * the result if a concurrent update of the port wins.
     */
    void setBinding(UUID segmentId, VifType vifType,
                    Map<String, Object> details);
}
