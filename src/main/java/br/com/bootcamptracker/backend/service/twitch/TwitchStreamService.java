package br.com.bootcamptracker.backend.service.twitch;

import br.com.bootcamptracker.backend.domain.entity.TwitchStream;
import br.com.bootcamptracker.backend.domain.repository.TwitchStreamRepository;
import br.com.bootcamptracker.backend.dto.TwitchStreamDTO;
import br.com.bootcamptracker.backend.jobs.payload.StreamPollJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Mantém o registro de live na Twitch de cada jogador.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwitchStreamService {

    private static final String TWITCH_URL = "https://www.twitch.tv/";

    private final TwitchAPIService twitchAPIService;
    private final TwitchStreamRepository twitchStreamRepository;

    @Transactional
    public boolean checkStream(StreamPollJob job) {
        List<TwitchStreamDTO> streams = twitchAPIService.getStreams(List.of(job.twitchUserId()));
        Optional<TwitchStream> latest = twitchStreamRepository.findFirstByTrackedPlayerIdOrderByIdDesc(job.playerId());

        if (!streams.isEmpty()) {
            TwitchStreamDTO live = streams.get(0);
            TwitchStream stream = latest.orElseGet(() -> TwitchStream.builder()
                    .trackedPlayerId(job.playerId())
                    .build());

            boolean wasLive = stream.isLive();
            stream.setLive(true);
            stream.setTwitchUserId(job.twitchUserId());
            stream.setStreamUrl(TWITCH_URL + job.twitchLogin());
            stream.setTitle(live.getTitle());
            stream.setStartedAt(parseStartedAt(live.getStartedAt()));
            stream.setEndedAt(null);
            stream.setLastChecked(Instant.now());
            twitchStreamRepository.save(stream);

            if (!wasLive) {
                log.info("🔴 [Twitch] {} está AO VIVO", job.twitchLogin());
            }
            return true;
        }

        if (latest.isPresent() && latest.get().isLive()) {
            TwitchStream stream = latest.get();
            stream.setLive(false);
            stream.setEndedAt(Instant.now());
            stream.setLastChecked(stream.getEndedAt());
            twitchStreamRepository.save(stream);
            log.info("📴 [Twitch] {} ficou offline", job.twitchLogin());
        }
        return false;
    }

    private static Instant parseStartedAt(String startedAt) {
        if (startedAt == null) {
            return Instant.now();
        }
        try {
            return Instant.parse(startedAt);
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }
}
