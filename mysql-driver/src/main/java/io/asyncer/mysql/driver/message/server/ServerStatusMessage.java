/*
 * Copyright 2023 asyncer.io projects
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncer.mysql.driver.message.server;

import io.asyncer.mysql.driver.constant.ServerStatuses;

/**
 * A message which contains the bitmap of server statuses, it may be the last message of a result.
 */
public interface ServerStatusMessage extends ServerMessage {

    /**
     * Get the bitmap of server statuses.
     *
     * @return the bitmap of server statuses.
     */
    short getServerStatuses();

    /**
     * Checks if the whole response is done, i.e. no more results follow this message.
     *
     * @return if done.
     */
    default boolean isDone() {
        return (getServerStatuses() & ServerStatuses.MORE_RESULTS_EXISTS) == 0;
    }
}
