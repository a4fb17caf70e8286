/**
 * Runtime composition.
 *
 * <p>{@link io.burnlock.runtime.LifecycleEngine} wires storage, the timer driver, the burn
 * scheduler, the handshake tracker and the messaging-facing service, and owns their start
 * and stop order: {@code new}, {@code initialize}, {@code loadPending}, {@code shutdown}.
 */
package io.burnlock.runtime;
