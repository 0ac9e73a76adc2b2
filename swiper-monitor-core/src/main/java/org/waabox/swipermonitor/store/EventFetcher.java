package org.waabox.swipermonitor.store;

import java.sql.Connection;
import java.util.List;

import org.waabox.swipermonitor.Watermark;

/**
 * Reads the offline events newer than a watermark.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface EventFetcher {

  /**
   * Fetches the events that occurred strictly after the watermark.
   *
   * <p>A failed query is not an error for the caller: it is logged and
   * reported as "no new events".
   *
   * @param connection the open connection to query, never null
   * @param watermark  the exclusive lower bound, never null
   *
   * @return the new events ordered by device description, never null
   */
  List<OfflineEvent> fetch(Connection connection, Watermark watermark);
}
