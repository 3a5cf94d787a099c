package br.com.fantasyflicks.backend.service.lock;

import br.com.fantasyflicks.backend.config.properties.DraftProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * ✅ Claim de expiração de turno entre instâncias
 * 
 * Quando várias instâncias observam o mesmo turno expirado, só quem
 * conseguir o claim tenta o auto-pick. O claim não garante nada sozinho: quem
 * decide é o compare-and-swap da sessão.
 * 
 * CHAVES REDIS:
 * - lock:draft:{sessionId}:expiry:{version} → instância que vai expirar o turno
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftTimerLockService {

    private static final String EXPIRY_LOCK_PREFIX = "lock:draft:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final DraftProperties draftProperties;

    /**
     * Tenta reservar a expiração do turno da versão informada.
     *
     * @return true se esta instância deve tentar o auto-pick
     */
    public boolean claimExpiry(Long sessionId, long version) {
        String key = expiryKey(sessionId, version);
        Duration ttl = Duration.ofSeconds(draftProperties.getExpiryClaimTtlSeconds());

        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, String.valueOf(version), ttl);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("🔒 [DraftTimerLock] Claim de expiração: sessão {} versão {}", sessionId, version);
                return true;
            }

            log.debug("[DraftTimerLock] Expiração da sessão {} versão {} já reservada", sessionId, version);
            return false;

        } catch (Exception e) {
            // sem Redis o CAS continua garantindo um único vencedor
            log.error("❌ [DraftTimerLock] Erro ao reservar expiração da sessão {}: {}", sessionId, e.getMessage());
            return true;
        }
    }

    public void releaseExpiry(Long sessionId, long version) {
        try {
            redisTemplate.delete(expiryKey(sessionId, version));
        } catch (Exception e) {
            log.error("❌ [DraftTimerLock] Erro ao liberar expiração da sessão {}: {}", sessionId, e.getMessage());
        }
    }

    static String expiryKey(Long sessionId, long version) {
        return EXPIRY_LOCK_PREFIX + sessionId + ":expiry:" + version;
    }
}
