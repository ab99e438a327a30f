import com.bluecats.loop.sdk.*;
import com.bluecats.loop.sdk.model.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Basic example demonstrating Loop Java SDK usage.
 *
 * Prerequisites:
 *   - Set LOOP_API_URL, LOOP_EMAIL and LOOP_PASSWORD environment variables
 */
public class BasicExample {
    public static void main(String[] args) {
        try (LoopClient client = LoopClient.fromEnv()) {

            // 1. Authenticate
            client.login(System.getenv("LOOP_EMAIL"), System.getenv("LOOP_PASSWORD"));
            System.out.println("Authenticated: " + client.isAuthenticated());

            // 2. Post two events from an edge relay
            String response = client.postEvents("AA:BB:CC:DD:EE:FF",
                    EventInfo.of(Map.of("objectType", "beacon", "objectID", "42", "eventType", "enter")),
                    EventInfo.of(Map.of("objectType", "beacon", "objectID", "42", "eventType", "exit")));
            System.out.println("Post response: " + response);

            // 3. Walk every page of the last day's events
            Instant now = Instant.now();
            EventQuery query = new EventQuery("beacon", "42")
                    .setLimit(100)
                    .setStartTime(now.minus(Duration.ofDays(1)))
                    .setEndTime(now);
            PaginatedEvents page = client.getPaginatedEvents(query);
            int total = page.getEvents().size();
            while (page.hasMore()) {
                query = page.nextPage(query);
                page = client.getPaginatedEvents(query);
                total += page.getEvents().size();
            }
            System.out.println("Events found: " + total);

            // 4. Async read
            client.getPaginatedEventsAsync(new EventQuery("beacon", "42").setLimit(1))
                    .thenAccept(p -> System.out.println("Latest page size: " + p.getEvents().size()))
                    .join();

            System.out.println("Done!");
        }
    }
}
