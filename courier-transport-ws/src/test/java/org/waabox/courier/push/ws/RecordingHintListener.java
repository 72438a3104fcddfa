package org.waabox.courier.push.ws;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.waabox.courier.push.HintListener;

/**
 * {@link HintListener} that records every callback.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RecordingHintListener implements HintListener {

  final List<String> texts = new CopyOnWriteArrayList<>();

  final List<String> closes = new CopyOnWriteArrayList<>();

  final List<Throwable> errors = new CopyOnWriteArrayList<>();

  volatile int pongs;

  @Override
  public void onText(final String frame) {
    texts.add(frame);
  }

  @Override
  public void onPong() {
    pongs++;
  }

  @Override
  public void onClose(final int code, final String reason) {
    closes.add(code + " " + reason);
  }

  @Override
  public void onError(final Throwable error) {
    errors.add(error);
  }
}
