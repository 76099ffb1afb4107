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
package org.midonet.switchport.inventory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A physical location: one port of one switch.
 */
public final class PortMapping {

    public final String switchName;
    public final String switchPort;

    public PortMapping(String switchName, String switchPort) {
        this.switchName = switchName;
        this.switchPort = switchPort;
    }

    /**
     * Parses a "host-id:switch-port" table entry. Only the first colon
     * separates the two, since switch port names may contain colons.
     *
     * @return A two element array holding the host id and the switch port.
     */
    static String[] parseEntry(String entry) {
        int idx = entry.indexOf(':');
        Preconditions.checkArgument(idx > 0 && idx < entry.length() - 1,
                                    "Invalid port mapping: %s", entry);
        return new String[] { entry.substring(0, idx).trim(),
                              entry.substring(idx + 1).trim() };
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof PortMapping)) return false;
        PortMapping other = (PortMapping) obj;
        return Objects.equal(switchName, other.switchName)
               && Objects.equal(switchPort, other.switchPort);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(switchName, switchPort);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("switchName", switchName)
            .add("switchPort", switchPort)
            .toString();
    }
}
