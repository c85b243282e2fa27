package io.evitadb.scriptor;

/**
 * Component holding resources that must be released when its owner shuts down.
 * The owner calls {@link #shutdown()} exactly once, in a defined teardown order.
 */
public interface Shutdownable {

	/**
	 * Releases the resources held by this component. Must not throw.
	 */
	void shutdown();
}
