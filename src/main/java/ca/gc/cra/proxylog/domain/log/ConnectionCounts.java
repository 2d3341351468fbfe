package ca.gc.cra.proxylog.domain.log;

/**
 * Connection counters HAProxy records when the session is logged ({@code act/fe/be/srv/retries}).
 *
 * @param active concurrent connections on the whole process
 * @param frontend concurrent connections on the frontend
 * @param backend concurrent connections on the backend
 * @param server concurrent connections on the server
 * @param retries connection retries performed for this session
 * @param redispatched {@code true} when the retries field carried a leading {@code +}, meaning the
 *     session was redispatched to another server
 * @since 0.1.0
 */
public record ConnectionCounts(
    int active, int frontend, int backend, int server, int retries, boolean redispatched) {

  public ConnectionCounts {
    if (active < 0 || frontend < 0 || backend < 0 || server < 0 || retries < 0) {
      throw new IllegalArgumentException("connection counts must be non-negative");
    }
  }
}
