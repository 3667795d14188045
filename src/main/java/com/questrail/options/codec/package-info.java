/**
 * Option Codecs
 * =============================================================================
 *
 * <p>Concrete {@link com.questrail.options.api.OptionCodec} implementations and
 * the {@link com.questrail.options.codec.OptionCodecs} factory that composes
 * them.</p>
 *
 * <h2>Separator Precedence</h2>
 * <p>Each container level reserves its own separator and escapes the text of
 * the level below against it with {@code '\'}:</p>
 *
 * <pre>
 *   list / map pairs   ':'
 *   map key/value      '='
 *   tuple fields       '|'
 * </pre>
 *
 * <p>The escape character is itself escaped at every level, so any nesting of
 * lists, maps, tuples and prefixed lists decodes back to the value it was
 * rendered from.</p>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Codecs are pure: no I/O, no logging, no shared mutable state.</li>
 *   <li>Decoded values are immutable.</li>
 *   <li>Ownership of the current value of an option lives in
 *       {@code com.questrail.options.runtime}, not here.</li>
 * </ul>
 */
package com.questrail.options.codec;
