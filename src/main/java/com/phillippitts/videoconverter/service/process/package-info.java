/**
 * External process plumbing: starting, draining and signalling encoder and metadata tools.
 */
package com.phillippitts.videoconverter.service.process;
