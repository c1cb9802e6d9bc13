// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.event;

@FunctionalInterface
public interface TorexEventListener {

    void onEvent(TorexEvent event);
}
