/**
 * Service Provider Interfaces (SPI) for the document ledger.
 *
 * <p>The core consumes three external collaborators through this package:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.ledger.spi.KeyService} - key wrapping and digest signing</li>
 *   <li>{@link io.github.hongjungwan.ledger.spi.BlobStore} - encrypted content storage</li>
 *   <li>{@link io.github.hongjungwan.ledger.spi.LedgerStore} - append-only hash records and chain blocks</li>
 * </ul>
 *
 * <p>Collaborators are passed explicitly to
 * {@link io.github.hongjungwan.ledger.api.DocumentLedgerFactory}; there are no
 * global instances.</p>
 */
package io.github.hongjungwan.ledger.spi;
