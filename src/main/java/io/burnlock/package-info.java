/**
 * Burnlock source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.burnlock.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.burnlock.cli.BurnlockCommand} maps commands to engine APIs.</li>
 *   <li>{@code io.burnlock.runtime.LifecycleEngine} composes the components and owns their lifecycle.</li>
 *   <li>{@code io.burnlock.burn.BurnScheduler} destroys messages on deadline, across restarts.</li>
 *   <li>{@code io.burnlock.storage.SqlitePersistenceGateway} is the only code that touches the database.</li>
 * </ul>
 */
package io.burnlock;
