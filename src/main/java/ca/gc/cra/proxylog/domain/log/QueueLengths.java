package ca.gc.cra.proxylog.domain.log;

/**
 * Queue depths at logging time ({@code srv_queue/backend_queue}).
 *
 * @param server requests queued on the server before this one
 * @param backend requests queued on the backend before this one
 * @since 0.1.0
 */
public record QueueLengths(int server, int backend) {

  public QueueLengths {
    if (server < 0 || backend < 0) {
      throw new IllegalArgumentException("queue lengths must be non-negative");
    }
  }
}
