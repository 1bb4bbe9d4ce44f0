package io.nosqlbench.sensordata.merge;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.sensordata.SensorDataException;

import java.util.List;

/// Thrown when two channel series carry the same name and would share one column.
public class ChannelNameCollisionException extends SensorDataException {

    private final String channelName;
    private final List<String> sources;

    public ChannelNameCollisionException(String channelName, List<String> sources) {
        super("Channel name '" + channelName + "' is used by more than one input: " + sources);
        this.channelName = channelName;
        this.sources = List.copyOf(sources);
    }

    public String getChannelName() {
        return channelName;
    }

    public List<String> getSources() {
        return sources;
    }
}
