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
package org.midonet.switchport;

/**
 * Base of the failures that abort the control plane event being handled.
 * The plugin framework is expected to roll back or reject the change.
 */
public class MechanismDriverException extends Exception {

    private static final long serialVersionUID = 1L;

    public MechanismDriverException(String message) {
        super(message);
    }

    public MechanismDriverException(String message, Throwable cause) {
        super(message, cause);
    }

    public MechanismDriverException(Throwable cause) {
        super(cause);
    }
}
