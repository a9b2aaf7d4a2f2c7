package world.willfrog.stream.mapper;

import org.apache.ibatis.annotations.*;
import world.willfrog.stream.entity.RunEvent;
import world.willfrog.stream.entity.RunEventSeqRange;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface RunEventMapper {

    /**
     * 重复的事件 ID、Run 已有 end 之后的任何事件都会被忽略，返回 0。
     */
    @Insert("INSERT INTO run_events (id, run_id, seq, event_type, data, created_at) " +
            "SELECT #{id}, #{runId}, #{seq}, #{eventType}, CAST(#{dataJson} AS jsonb), #{createdAt} " +
            "WHERE NOT EXISTS (SELECT 1 FROM run_events WHERE run_id = #{runId} AND event_type = 'end') " +
            "ON CONFLICT DO NOTHING")
    int insert(RunEvent event);

    @Select("SELECT id, run_id, seq, event_type, data, created_at FROM run_events " +
            "WHERE run_id = #{runId} ORDER BY seq ASC")
    @Results(id = "runEventResultMap", value = {
            @Result(property = "id", column = "id", id = true),
            @Result(property = "runId", column = "run_id"),
            @Result(property = "seq", column = "seq"),
            @Result(property = "eventType", column = "event_type"),
            @Result(property = "dataJson", column = "data"),
            @Result(property = "createdAt", column = "created_at")
    })
    List<RunEvent> listByRunId(@Param("runId") String runId);

    @Select("SELECT id, run_id, seq, event_type, data, created_at FROM run_events " +
            "WHERE run_id = #{runId} AND seq > #{afterSeq} ORDER BY seq ASC")
    @ResultMap("runEventResultMap")
    List<RunEvent> listByRunIdAfterSeq(@Param("runId") String runId,
                                       @Param("afterSeq") long afterSeq);

    @Select("SELECT id, run_id, seq, event_type, data, created_at FROM run_events " +
            "WHERE run_id = #{runId} ORDER BY seq DESC LIMIT 1")
    @ResultMap("runEventResultMap")
    RunEvent findLatestByRunId(@Param("runId") String runId);

    @Select("SELECT id, run_id, seq, event_type, data, created_at FROM run_events " +
            "WHERE run_id = #{runId} AND event_type = 'end' LIMIT 1")
    @ResultMap("runEventResultMap")
    RunEvent findTerminalByRunId(@Param("runId") String runId);

    @Select("SELECT MIN(seq) AS first_seq, MAX(seq) AS last_seq, COUNT(*) AS row_count " +
            "FROM run_events WHERE run_id = #{runId}")
    @Results({
            @Result(property = "firstSeq", column = "first_seq"),
            @Result(property = "lastSeq", column = "last_seq"),
            @Result(property = "rowCount", column = "row_count")
    })
    RunEventSeqRange findSeqRange(@Param("runId") String runId);

    @Delete("DELETE FROM run_events WHERE run_id = #{runId}")
    int deleteByRunId(@Param("runId") String runId);

    @Delete("DELETE FROM run_events WHERE created_at < #{cutoff}")
    int deleteCreatedBefore(@Param("cutoff") OffsetDateTime cutoff);
}
