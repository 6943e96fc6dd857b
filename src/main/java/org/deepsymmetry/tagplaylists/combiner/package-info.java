/**
 * Evaluates the boolean expressions that define Combiner playlists, and reports which tags their tracks carry.
 */
package org.deepsymmetry.tagplaylists.combiner;
