package com.bell.alerter.alert;

import com.bell.protocol.AnomalyEvent;

/** Receives every anomaly event the alerter accepts, on a network thread. */
public interface AlertListener {

  void onAnomaly(AnomalyEvent event);
}
