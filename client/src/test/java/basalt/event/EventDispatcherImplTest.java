package basalt.event;

import basalt.player.BasaltPlayer;
import basalt.player.Track;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class EventDispatcherImplTest {
    private final EventDispatcherImpl dispatcher = new EventDispatcherImpl();
    private final BasaltPlayer player = mock(BasaltPlayer.class);

    @Test
    void failingListenerDoesNotStopOthers() {
        var seen = new ArrayList<String>();
        dispatcher.register(new BasaltEventListener() {
            @Override
            public void onTrackStart(BasaltPlayer player, Track track) {
                throw new IllegalStateException("listener failure");
            }
        });
        dispatcher.register(recording(seen));

        dispatcher.onTrackStart(player, new Track("QUFB"));

        assertThat(seen).containsExactly("start:QUFB");
    }

    @Test
    void unregisteredListenerIsNotCalled() {
        var seen = new ArrayList<String>();
        var listener = recording(seen);
        dispatcher.register(listener);
        dispatcher.unregister(listener);

        dispatcher.onTrackEnd(player, new Track("QUFB"), "finished");
        dispatcher.onPlayerRegistered("main", player);

        assertThat(seen).isEmpty();
    }

    @Test
    void defaultMethodsIgnoreEvents() {
        dispatcher.register(new BasaltEventListener() {});

        dispatcher.onNodeReady("main", "abc", false);
        dispatcher.onWebSocketClosed(player, 4006, null, true);
    }

    private static BasaltEventListener recording(List<String> seen) {
        return new BasaltEventListener() {
            @Override
            public void onTrackStart(BasaltPlayer player, Track track) {
                seen.add("start:" + track.encoded());
            }

            @Override
            public void onTrackEnd(BasaltPlayer player, Track track, String reason) {
                seen.add("end:" + reason);
            }

            @Override
            public void onPlayerRegistered(String nodeId, BasaltPlayer player) {
                seen.add("registered:" + nodeId);
            }
        };
    }
}
