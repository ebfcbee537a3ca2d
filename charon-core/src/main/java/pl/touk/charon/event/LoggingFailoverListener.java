/*
 * Copyright 2012 TouK
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
package pl.touk.charon.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingFailoverListener implements FailoverListener {

    static private final Logger logger = LoggerFactory.getLogger(LoggingFailoverListener.class);

    public void onEvent(FailoverEvent event) {
        switch (event.getKind()) {
            case CACHE_UNAVAILABLE:
                logger.error("event: " + event, event.getCause());
                break;
            case PRIMARY_DOWN:
            case FAILOVER_DOWN:
            case LIMITED_FUNCTIONALITY_ACTIVATED:
                logger.warn("event: " + event);
                break;
            default:
                logger.info("event: " + event);
                break;
        }
    }
}
