package org.waabox.swipermonitor.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot entry point of the embed swiper offline monitor.
 *
 * <p>The process has no web server: it stays alive while the monitor loop
 * thread runs and exits once a SIGTERM or SIGINT has stopped the loop and
 * the final metrics were saved. A failed startup health check or an invalid
 * configuration aborts the context refresh and exits with a non-zero
 * status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class SwiperMonitorApplication {

  /** Launches the monitor.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(SwiperMonitorApplication.class, args);
  }
}
