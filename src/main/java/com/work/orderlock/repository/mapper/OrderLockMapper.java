package com.work.orderlock.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.orderlock.repository.entity.OrderLockEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

/**
 * order_locks 表 Mapper。
 * <p>
 * 所有写操作都是单条条件语句（INSERT ... ON CONFLICT / UPDATE ... WHERE / DELETE ... WHERE），
 * 从不在应用内存中做 read-modify-write。带 RETURNING 的语句以 @Select 形式声明，需强制刷新一级缓存。
 */
public interface OrderLockMapper extends BaseMapper<OrderLockEntity> {

    String COLUMNS = "id, order_type, order_id, locked_by_user_id, locked_by_session_id, " +
            "locked_at, expires_at, last_activity_at";

    /**
     * 插入新锁；若 order_id 已存在，仅当旧锁已过期（接管）或属于同一 user+session（续期）时才覆盖。
     * <p>接管时整行替换；续期时保留 id、order_type 与 locked_at。</p>
     * <p>写入未生效时，同一条语句顺带返回当前持有者（applied=false），调用方无需再查一次。
     * 该行来自语句开始时的快照，可能已被并发事务改写或删除；若完全没有返回行，说明冲突行
     * 由快照之后提交的事务插入。</p>
     * <p>并发接管同一条过期记录时，ON CONFLICT 会对冲突行加锁并在拿到锁后重新评估 WHERE，
     * 因此只有一个调用方能拿到 applied=true。</p>
     */
    @Select("WITH attempt AS (" +
            "INSERT INTO order_locks(" + COLUMNS + ") " +
            "VALUES(#{id}, #{orderType}, #{orderId}, #{userId}, #{sessionId}, #{now}, #{expiresAt}, #{now}) " +
            "ON CONFLICT(order_id) DO UPDATE SET " +
            "id = CASE WHEN order_locks.expires_at < #{now} THEN EXCLUDED.id ELSE order_locks.id END, " +
            "order_type = CASE WHEN order_locks.expires_at < #{now} THEN EXCLUDED.order_type ELSE order_locks.order_type END, " +
            "locked_by_user_id = EXCLUDED.locked_by_user_id, " +
            "locked_by_session_id = EXCLUDED.locked_by_session_id, " +
            "locked_at = CASE WHEN order_locks.expires_at < #{now} THEN EXCLUDED.locked_at ELSE order_locks.locked_at END, " +
            "expires_at = EXCLUDED.expires_at, " +
            "last_activity_at = EXCLUDED.last_activity_at " +
            "WHERE order_locks.expires_at < #{now} " +
            "OR (order_locks.locked_by_user_id = #{userId} AND order_locks.locked_by_session_id = #{sessionId}) " +
            "RETURNING " + COLUMNS + ") " +
            "SELECT " + COLUMNS + ", TRUE AS applied FROM attempt " +
            "UNION ALL " +
            "SELECT " + COLUMNS + ", FALSE AS applied FROM order_locks " +
            "WHERE order_id = #{orderId} AND NOT EXISTS (SELECT 1 FROM attempt)")
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    OrderLockEntity tryAcquire(@Param("id") String id,
                               @Param("orderType") String orderType,
                               @Param("orderId") String orderId,
                               @Param("userId") String userId,
                               @Param("sessionId") String sessionId,
                               @Param("now") Instant now,
                               @Param("expiresAt") Instant expiresAt);

    @Select("SELECT " + COLUMNS + " FROM order_locks WHERE order_id = #{orderId}")
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    OrderLockEntity selectByOrderId(@Param("orderId") String orderId);

    /**
     * 仅当前、未过期的持有 session 可以续期。返回 null 表示未持有。
     */
    @Select("UPDATE order_locks SET expires_at = #{expiresAt}, last_activity_at = #{now} " +
            "WHERE order_id = #{orderId} AND locked_by_session_id = #{sessionId} AND expires_at >= #{now} " +
            "RETURNING " + COLUMNS)
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    OrderLockEntity renew(@Param("orderId") String orderId,
                          @Param("sessionId") String sessionId,
                          @Param("now") Instant now,
                          @Param("expiresAt") Instant expiresAt);

    /**
     * 删除该 session 持有的锁。未删除时顺带返回当前记录（applied=false），用于区分"无人持有"与"他人持有"。
     */
    @Select("WITH released AS (" +
            "DELETE FROM order_locks WHERE order_id = #{orderId} AND locked_by_session_id = #{sessionId} " +
            "RETURNING " + COLUMNS + ") " +
            "SELECT " + COLUMNS + ", TRUE AS applied FROM released " +
            "UNION ALL " +
            "SELECT " + COLUMNS + ", FALSE AS applied FROM order_locks " +
            "WHERE order_id = #{orderId} AND NOT EXISTS (SELECT 1 FROM released)")
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    OrderLockEntity release(@Param("orderId") String orderId, @Param("sessionId") String sessionId);

    @Select("SELECT " + COLUMNS + " FROM order_locks WHERE expires_at >= #{now} ORDER BY expires_at ASC")
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    List<OrderLockEntity> listLive(@Param("now") Instant now);

    /**
     * 过期清理：删除 expires_at 早于 cutoff 的记录。
     */
    @Delete("DELETE FROM order_locks WHERE expires_at < #{cutoff}")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
