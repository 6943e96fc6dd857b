/**
 * <p>Builds playlists automatically from the tags carried by the tracks of a DJ collection.</p>
 *
 * <p>A {@link org.deepsymmetry.tagplaylists.PlaylistBuilder} runs each configured
 * {@link org.deepsymmetry.tagplaylists.TagParser} over the collection, recording the results in a
 * {@link org.deepsymmetry.tagplaylists.TagIndex}, then organizes them into folders and playlists according to a
 * taxonomy for each parser (see the {@link org.deepsymmetry.tagplaylists.taxonomy} package). Playlists defined by
 * boolean expressions over tags, playlists, tempos and ratings are then added by the
 * {@link org.deepsymmetry.tagplaylists.combiner.Combiner}.</p>
 *
 * <p>Reading and writing the collection document itself is left to the caller, which supplies the tracks as a
 * {@link org.deepsymmetry.tagplaylists.TrackCollection} and receives the result as a
 * {@link org.deepsymmetry.tagplaylists.taxonomy.PlaylistTree}.</p>
 */
package org.deepsymmetry.tagplaylists;
