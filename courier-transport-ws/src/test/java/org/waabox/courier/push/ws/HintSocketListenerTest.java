package org.waabox.courier.push.ws;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HintSocketListener}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HintSocketListenerTest {

  @Test
  void whenOpening_shouldRequestTheFirstMessage() {
    final WebSocket socket = createMock(WebSocket.class);
    socket.request(1);
    expectLastCall();
    replay(socket);

    new HintSocketListener(new RecordingHintListener()).onOpen(socket);

    verify(socket);
  }

  @Test
  void whenReceivingText_givenFragments_shouldForwardOneFrame() {
    final RecordingHintListener hints = new RecordingHintListener();
    final WebSocket socket = createMock(WebSocket.class);
    socket.request(1);
    expectLastCall().times(3);
    replay(socket);

    final HintSocketListener listener = new HintSocketListener(hints);
    listener.onText(socket, "{\"action\"", false);
    listener.onText(socket, ":\"notify\"}", true);
    listener.onText(socket, "{\"action\":\"pong\"}", true);

    assertEquals(List.of("{\"action\":\"notify\"}", "{\"action\":\"pong\"}"),
        hints.texts);
    verify(socket);
  }

  @Test
  void whenReceivingPong_shouldForwardAndRequestMore() {
    final RecordingHintListener hints = new RecordingHintListener();
    final WebSocket socket = createMock(WebSocket.class);
    socket.request(1);
    expectLastCall().times(2);
    replay(socket);

    final HintSocketListener listener = new HintSocketListener(hints);
    listener.onPong(socket, ByteBuffer.allocate(0));
    listener.onBinary(socket, ByteBuffer.wrap(new byte[] {1}), true);

    assertEquals(1, hints.pongs);
    assertTrue(hints.texts.isEmpty());
    verify(socket);
  }

  @Test
  void whenClosedOrFailing_shouldForwardToTheHintListener() {
    final RecordingHintListener hints = new RecordingHintListener();
    final WebSocket socket = createMock(WebSocket.class);
    replay(socket);

    final HintSocketListener listener = new HintSocketListener(hints);
    final IOException failure = new IOException("reset");
    listener.onClose(socket, 1006, "gone");
    listener.onError(socket, failure);

    assertEquals(List.of("1006 gone"), hints.closes);
    assertSame(failure, hints.errors.get(0));
    verify(socket);
  }
}
