package br.edu.ifba.asrgot.algorithms;

/**
 * Connectivity figures of a graph.
 *
 * @param components number of weakly connected components
 * @param paths      number of ordered node pairs (u, v), u != v, with a directed path from u to v
 */
public record ConnectivitySummary(int components, int paths) {
}
