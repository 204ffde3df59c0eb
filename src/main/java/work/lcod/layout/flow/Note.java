package work.lcod.layout.flow;

import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.Location;

/**
 * A footnote discovered in the flow, identified by the location of its marker.
 */
record Note(Location location, FootnoteContent elem) {}
