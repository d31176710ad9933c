/**
 * Inbound side of the bridge: one listening socket, a receive loop and a
 * dispatch pool delivering decoded messages to subscribers.
 */
package com.questrail.wrpbridge.inbound;
