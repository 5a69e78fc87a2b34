/**
 * Record-and-replay harness for writer scenarios whose inputs are nondeterministic.
 */
package ca.gc.cra.chunkio.infrastructure.replay;
