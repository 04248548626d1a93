/**
 * Requests, responses and their lifecycle.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilienthttp.domain.model.TransferRequest} - Request with an explicit id and observable state</li>
 *   <li>{@link fr.lapetina.resilienthttp.domain.model.TransferResponse} - Immutable response record</li>
 *   <li>{@link fr.lapetina.resilienthttp.domain.model.RequestState} - {@code NEW}, {@code TRANSFER}, {@code COMPLETE}, {@code ERROR}</li>
 *   <li>{@link fr.lapetina.resilienthttp.domain.model.RequestStateListener} - Callback on every transition</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code TransferRequest} keeps its state in an {@code AtomicReference} and its listeners in a
 * {@code CopyOnWriteArrayList}; a pooled request is completed on a transport callback thread.
 */
package fr.lapetina.resilienthttp.domain.model;
