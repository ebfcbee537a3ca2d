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
import pl.touk.charon.Utils;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers events to the registered listeners in registration order. A failing listener is logged and skipped;
 * it never affects the remaining listeners nor the caller.
 */
public class FailoverEventDispatcher {

    static private final Logger logger = LoggerFactory.getLogger(FailoverEventDispatcher.class);

    private final List<FailoverListener> listeners = new CopyOnWriteArrayList<FailoverListener>();

    public FailoverEventDispatcher() {
    }

    public FailoverEventDispatcher(List<? extends FailoverListener> listeners) {
        Utils.assertNotNull(listeners, "listeners");
        for (FailoverListener l : listeners) {
            addListener(l);
        }
    }

    public void addListener(FailoverListener listener) {
        Utils.assertNotNull(listener, "listener");
        listeners.add(listener);
    }

    public boolean removeListener(FailoverListener listener) {
        return listeners.remove(listener);
    }

    public void dispatch(FailoverEvent event) {
        Utils.assertNotNull(event, "event");
        for (FailoverListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                logger.error("listener " + l + " failed to handle " + event, e);
            }
        }
    }
}
