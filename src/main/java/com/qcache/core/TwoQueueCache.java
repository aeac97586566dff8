package com.qcache.core;

import com.qcache.core.model.CacheEntry;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Sabit boyutlu, thread-safe 2Q önbelleğidir. Anahtarlar üç LRU havuzuna
 * bölünür: yalnızca bir kez görülenler {@code recent}, en az iki kez görülenler
 * {@code frequent} havuzunda tutulur; {@code recent} havuzundan yakın zamanda
 * tahliye edilen anahtarlar ise değersiz "hayalet" kayıtlar olarak
 * {@code recentEvict} içinde saklanır. Böylece yeni anahtarlara gelen tek
 * seferlik bir erişim patlaması sık kullanılan girdileri önbellekten atamaz.
 *
 * <p>{@code recent} ve {@code frequent} havuzlarının her biri toplam boyut
 * kadar kapasiteyle oluşturulur; iki havuz arasındaki denge LRU kapasitesiyle
 * değil, {@link #ensureSpace(boolean)} içindeki {@code recentSize} kontrolüyle
 * sağlanır.</p>
 *
 * <p>Tüm genel işlemler tek bir okuma-yazma kilidi altında çalışır. Sıralamayı
 * değiştiren işlemler yazma kilidini, saf okumalar okuma kilidini alır.
 * Tahliye dinleyicisi kilit tutulurken çağrılır ve önbelleğe geri çağrı
 * yapmamalıdır.</p>
 */
public final class TwoQueueCache<K, V> implements Cache<K, V>
{
    private static final Logger LOG = Logger.getLogger(TwoQueueCache.class);

    /** Yalnızca bir kez erişilmiş girdilere ayrılan oran. */
    public static final double DEFAULT_RECENT_RATIO = 0.25;

    /** Tahliye edilen girdileri izlemek için tutulan hayalet kayıt oranı. */
    public static final double DEFAULT_GHOST_RATIO = 0.50;

    private final int size;
    private final int recentSize;
    private final int ghostSize;

    private final LruCache<K, V> recent;
    private final LruCache<K, V> frequent;
    private final LruCache<K, Boolean> recentEvict; // null when ghostSize == 0
    private final EvictionListener<K, V> onEvict;   // nullable

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public TwoQueueCache(int size)
    {
        this(size, DEFAULT_RECENT_RATIO, DEFAULT_GHOST_RATIO, null);
    }

    public TwoQueueCache(int size, double recentRatio, double ghostRatio)
    {
        this(size, recentRatio, ghostRatio, null);
    }

    private TwoQueueCache(int size, double recentRatio, double ghostRatio, EvictionListener<K, V> onEvict)
    {
        if (size <= 0) {
            throw new IllegalArgumentException("invalid size");
        }
        if (recentRatio < 0.0 || recentRatio > 1.0) {
            throw new IllegalArgumentException("invalid recent ratio");
        }
        if (ghostRatio < 0.0 || ghostRatio > 1.0) {
            throw new IllegalArgumentException("invalid ghost ratio");
        }

        this.size = size;
        this.recentSize = (int) (size * recentRatio);
        this.ghostSize = (int) (size * ghostRatio);
        this.onEvict = onEvict;
        this.recent = new LruCache<>(size, this::notifyEvict);
        this.frequent = new LruCache<>(size, this::notifyEvict);
        this.recentEvict = ghostSize > 0 ? new LruCache<>(ghostSize) : null;

        LOG.debugf("2Q cache created: size=%d recentSize=%d ghostSize=%d", size, recentSize, ghostSize);
    }

    public static <K, V> Builder<K, V> builder(int size) { return new Builder<>(size); }

    /**
     * Oranları ve tahliye dinleyicisini ayarlamaya yarayan akıcı yapılandırma sınıfı.
     */
    public static final class Builder<K, V>
    {
        private final int size;
        private double recentRatio = DEFAULT_RECENT_RATIO, ghostRatio = DEFAULT_GHOST_RATIO;
        private EvictionListener<K, V> onEvict;
        private Builder(int size) { this.size = size; }
        public Builder<K, V> recentRatio(double r) { this.recentRatio = r; return this; }
        public Builder<K, V> ghostRatio(double r) { this.ghostRatio = r; return this; }
        public Builder<K, V> onEvict(EvictionListener<K, V> l) { this.onEvict = l; return this; }
        public TwoQueueCache<K, V> build() { return new TwoQueueCache<>(size, recentRatio, ghostRatio, onEvict); }
    }

    /**
     * Değeri arar. {@code frequent} içindeki anahtar orada öne alınır;
     * {@code recent} içindeki anahtar ise ikinci erişim olduğu için
     * {@code frequent} havuzuna terfi ettirilir.
     */
    @Override
    public Optional<V> get(K key)
    {
        lock.writeLock().lock();
        try {
            Optional<V> value = frequent.get(key);
            if (value.isPresent()) {
                return value;
            }

            value = recent.detach(key);
            value.ifPresent(v -> frequent.add(key, v));
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Değeri ekler. Yeni anahtar {@code recent} havuzuna girer; zaten bilinen
     * ya da yakın zamanda tahliye edilmiş (hayalet) bir anahtar doğrudan
     * {@code frequent} havuzuna yazılır.
     *
     * @return yer açmak için bir girdi tahliye edildiyse {@code true}
     */
    @Override
    public boolean add(K key, V value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.writeLock().lock();
        try {
            if (frequent.contains(key)) {
                frequent.add(key, value);
                return false;
            }

            if (recent.detach(key).isPresent()) {
                frequent.add(key, value);
                return false;
            }

            if (isGhost(key)) {
                boolean evicted = ensureSpace(true);
                recentEvict.remove(key);
                frequent.add(key, value);
                return evicted;
            }

            boolean evicted = ensureSpace(false);
            recent.add(key, value);
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Toplam girdi sayısı hedef boyuta ulaştıysa tam olarak bir girdi tahliye eder.
     * {@code recent} hedefini aşmışsa (ya da hedefte olup çağıran bir hayalet
     * terfisi değilse) oradaki en eski girdi hayalete dönüştürülür; aksi halde
     * {@code frequent} havuzunun en eskisi iz bırakmadan atılır.
     */
    private boolean ensureSpace(boolean recentEvictHint)
    {
        int recentLen = recent.len();
        int freqLen = frequent.len();
        if (recentLen + freqLen < size) {
            return false;
        }

        if (recentLen > 0 && (recentLen > recentSize || (recentLen == recentSize && !recentEvictHint))) {
            CacheEntry<K, V> victim = recent.removeOldest().orElseThrow();
            recordGhost(victim.key());
            if (LOG.isTraceEnabled()) {
                LOG.tracef("Evicted %s from recent pool into ghost pool", victim.key());
            }
            return true;
        }

        Optional<CacheEntry<K, V>> victim = frequent.removeOldest();
        if (victim.isEmpty()) {
            return false;
        }
        if (LOG.isTraceEnabled()) {
            LOG.tracef("Evicted %s from frequent pool", victim.get().key());
        }
        return true;
    }

    /**
     * Anahtarı hangi havuzdaysa oradan siler. Hayalet kayıtlar da temizlenir,
     * fakat sonuç yalnızca önbellekte tutulan bir değer silindiğinde {@code true} olur.
     */
    @Override
    public boolean remove(K key)
    {
        lock.writeLock().lock();
        try {
            if (frequent.remove(key) || recent.remove(key)) {
                return true;
            }
            if (recentEvict != null) {
                recentEvict.remove(key);
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Hayalet kayıtlar önbellek verisi sayılmaz. */
    @Override
    public boolean contains(K key)
    {
        lock.readLock().lock();
        try {
            return frequent.contains(key) || recent.contains(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Sıralamayı ve havuz üyeliğini değiştirmeden değeri döndürür. */
    @Override
    public Optional<V> peek(K key)
    {
        lock.readLock().lock();
        try {
            Optional<V> value = frequent.peek(key);
            return value.isPresent() ? value : recent.peek(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Önce {@code frequent}, ardından {@code recent} anahtarları; her biri en eskiden en yeniye. */
    @Override
    public List<K> keys()
    {
        lock.readLock().lock();
        try {
            List<K> keys = frequent.keys();
            keys.addAll(recent.keys());
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int len()
    {
        lock.readLock().lock();
        try {
            return recent.len() + frequent.len();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void purge()
    {
        lock.writeLock().lock();
        try {
            recent.purge();
            frequent.purge();
            if (recentEvict != null) {
                recentEvict.purge();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() { return size; }
    public int recentSize() { return recentSize; }
    public int ghostSize() { return ghostSize; }

    private boolean isGhost(K key)
    {
        return recentEvict != null && recentEvict.contains(key);
    }

    private void recordGhost(K key)
    {
        if (recentEvict != null) {
            recentEvict.add(key, Boolean.TRUE);
        }
    }

    /**
     * {@code recent} ve {@code frequent} havuzlarının dinleyicisi. Havuzdan
     * ayrılan her girdi buradan geçer; terfi sırasında kullanılan
     * {@link LruCache#detach(Object)} ise bildirim yapmaz.
     */
    private void notifyEvict(K key, V value)
    {
        if (onEvict != null) {
            onEvict.onEvict(key, value);
        }
    }
}
