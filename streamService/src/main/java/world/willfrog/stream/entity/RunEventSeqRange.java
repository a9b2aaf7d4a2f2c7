package world.willfrog.stream.entity;

import lombok.Data;

@Data
public class RunEventSeqRange {
    private Long firstSeq;
    private Long lastSeq;
    private Long rowCount;
}
