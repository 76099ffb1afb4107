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
package org.midonet.switchport.cluster.data.neutron;

import java.util.List;
import java.util.UUID;

import javax.annotation.Nonnull;

import org.midonet.switchport.cluster.StateAccessException;

/**
 * Read access to the control plane object store. Every call reads the
 * current state; callers never get a view that updates behind their back.
 */
public interface NeutronStore {

    /**
     * Retrieve a port. Returns null if the resource does not exist.
     *
     * @param id ID of the Port object to get
     * @return Port object
     */
    Port getPort(@Nonnull UUID id) throws StateAccessException;

    /**
     * Get the ports on a network owned by the given kind of device.
     *
     * @param networkId ID of the network the ports belong to
     * @param owner Device owner to filter by
     * @return List of Port objects, possibly empty
     */
    List<Port> getPorts(@Nonnull UUID networkId, @Nonnull DeviceOwner owner)
        throws StateAccessException;

    /**
     * Get every port with the given MAC address, on any network.
     *
     * @param macAddress MAC address, compared case-insensitively
     * @return List of Port objects, possibly empty
     */
    List<Port> getPortsByMac(@Nonnull String macAddress)
        throws StateAccessException;

    /**
     * Retrieve a network. Returns null if the resource does not exist.
     *
     * @param id ID of the Network object to get
     * @return Network object
     */
    Network getNetwork(@Nonnull UUID id) throws StateAccessException;

    /**
     * Get all the segments, of any network, with the given segmentation id.
     *
     * @param segmentationId Segmentation id to filter by
     * @return List of NetworkSegment objects, possibly empty
     */
    List<NetworkSegment> getSegments(int segmentationId)
        throws StateAccessException;

    /**
     * Retrieve the trunk whose parent is the given port. Returns null if the
     * port is not a trunk parent.
     *
     * @param portId ID of the parent port
     * @return Trunk object
     */
    Trunk getTrunkByPortId(@Nonnull UUID portId) throws StateAccessException;

    /**
     * Register the given entity as a provisioning blocker of a port: the
     * port will not go ACTIVE until the entity reports completion.
     */
    void addProvisioningComponent(@Nonnull UUID portId, @Nonnull String entity)
        throws StateAccessException;

    /**
     * Report that the given entity completed the provisioning of a port.
     */
    void provisioningComplete(@Nonnull UUID portId, @Nonnull String entity)
        throws StateAccessException;
}
