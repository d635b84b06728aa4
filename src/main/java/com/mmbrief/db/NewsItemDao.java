package com.mmbrief.db;

import com.mmbrief.core.StoreConnectException;
import com.mmbrief.core.StoreWriteException;
import com.mmbrief.db.mybatis.MyBatisSupport;
import com.mmbrief.db.mybatis.NewsItemMapper;
import com.mmbrief.db.mybatis.NewsItemRow;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * DAO for news_items on the store's shared connection. Rows are insert-or-ignore on
 * {@code (ticker, title)}.
 */
public final class NewsItemDao {
    private final JdbcMarketStore store;
    private final Clock clock;

    public NewsItemDao(JdbcMarketStore store) {
        this(store, Clock.systemUTC());
    }

    public NewsItemDao(JdbcMarketStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public int insertAll(List<NewsItemRow> items) throws StoreWriteException {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        long now = clock.instant().getEpochSecond();
        int inserted = 0;
        try (SqlSession session = MyBatisSupport.openSession(store.connection())) {
            NewsItemMapper mapper = session.getMapper(NewsItemMapper.class);
            for (NewsItemRow item : items) {
                if (item == null || isBlank(item.getTicker()) || isBlank(item.getTitle())) {
                    continue;
                }
                NewsItemRow row = NewsItemRow.builder()
                        .ticker(item.getTicker().trim().toUpperCase(Locale.ROOT))
                        .title(item.getTitle().trim())
                        .publisher(item.getPublisher())
                        .link(item.getLink())
                        .providerPublishTime(item.getProviderPublishTime() == null ? now : item.getProviderPublishTime())
                        .createdAt(now)
                        .build();
                inserted += Math.max(0, mapper.insertIgnore(row));
            }
        } catch (SQLException | PersistenceException e) {
            throw new StoreWriteException("news insert failed: items=" + items.size(), e);
        }
        return inserted;
    }

    /**
     * News for a ticker published within the last {@code hours}, newest first.
     */
    public List<NewsItemRow> recent(String ticker, int hours) throws StoreConnectException {
        long since = clock.instant().getEpochSecond() - Math.max(0, hours) * 3600L;
        try (SqlSession session = MyBatisSupport.openSession(store.connection())) {
            return session.getMapper(NewsItemMapper.class)
                    .selectRecent(ticker.trim().toUpperCase(Locale.ROOT), since);
        } catch (SQLException | PersistenceException e) {
            throw new StoreConnectException("news read failed: ticker=" + ticker, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
