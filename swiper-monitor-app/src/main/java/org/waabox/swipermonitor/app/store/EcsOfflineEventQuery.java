package org.waabox.swipermonitor.app.store;

import org.waabox.swipermonitor.store.EventQuery;

/** The offline event query of the ECS game management database (SQL
 * Server).
 *
 * <p>Selects the games whose swiper was placed offline: log comments
 * starting with {@code Swiper placed Offline} are aggregated per game and
 * log time, joined to the matching swipe event (type 44), its user and the
 * active swiper unit, excluding retired swipers. Only the newest event per
 * game is kept, and only if it is newer than the watermark.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EcsOfflineEventQuery implements EventQuery {

  /** The event type of a swiper status change. */
  static final int SWIPER_EVENT_TYPE = 44;

  /** The comment prefix written when a swiper goes offline. */
  static final String OFFLINE_COMMENT_PREFIX = "Swiper placed Offline";

  /** The T-SQL text, with the watermark as its only parameter. */
  private static final String SQL =
      "WITH offline_events AS ("
      + " SELECT"
      + "   ROW_NUMBER() OVER (PARTITION BY gs.game_id"
      + "     ORDER BY gl.log_datetime DESC) AS rn,"
      + "   gs.swiper_description,"
      + "   u.user_name,"
      + "   gl.comment,"
      + "   gl.log_datetime,"
      + "   DATEDIFF(dd, gl.log_datetime, CURRENT_TIMESTAMP) AS days_offline"
      + " FROM ecs7.dbo.game_swipers gs"
      + " JOIN ("
      + "   SELECT game_id, log_datetime,"
      + "     STRING_AGG(TRIM(comment), ', ') AS comment"
      + "   FROM ecs7.dbo.game_log"
      + "   WHERE comment LIKE '" + OFFLINE_COMMENT_PREFIX + "%'"
      + "   GROUP BY game_id, log_datetime"
      + " ) gl ON gs.game_id = gl.game_id"
      + " JOIN ecs7.dbo.game_events ge"
      + "   ON ge.game_id = gl.game_id"
      + "   AND ge.event_time = gl.log_datetime"
      + " JOIN ecs7.dbo.users u ON ge.user_id = u.user_id"
      + " JOIN ecs7.dbo.swiper_units su ON su.game_id = gs.game_id"
      + " WHERE gs.retired IS NULL"
      + "   AND ge.event_type = " + SWIPER_EVENT_TYPE
      + "   AND su.status = 1"
      + ")"
      + " SELECT"
      + "   swiper_description AS device_description,"
      + "   user_name,"
      + "   comment,"
      + "   log_datetime AS occurred_at,"
      + "   days_offline"
      + " FROM offline_events"
      + " WHERE rn = 1 AND log_datetime > ?"
      + " ORDER BY swiper_description";

  @Override
  public String sql() {
    return SQL;
  }
}
