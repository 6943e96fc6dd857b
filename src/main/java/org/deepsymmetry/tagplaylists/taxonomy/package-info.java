/**
 * Describes how tag playlists are organized into folders, and builds and fills the resulting tree of folders
 * and playlists. Folders named {@value org.deepsymmetry.tagplaylists.taxonomy.PlaylistTaxonomy#IGNORE_FOLDER}
 * mark tags as known without creating playlists for them.
 */
package org.deepsymmetry.tagplaylists.taxonomy;
