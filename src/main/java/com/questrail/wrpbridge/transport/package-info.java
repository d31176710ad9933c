/**
 * Frame transport port.
 *
 * <p>The bridge core talks to the network only through {@link com.questrail.wrpbridge.transport.Transport}
 * and its two socket types. Network library types never leave the
 * implementation packages below this one.</p>
 */
package com.questrail.wrpbridge.transport;
