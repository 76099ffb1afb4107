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

import org.midonet.switchport.cluster.data.neutron.Network;

/**
 * The network an event is about, as handed over by the plugin framework.
 */
public interface NetworkContext {

    /**
     * The network as of the event: the new state on create, the last state
     * before removal on delete.
     */
    Network current();
}
