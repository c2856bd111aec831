package cn.bafuka.timecache.score;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 对数域分数寄存器
 * logScore 为 log2(分数) 加上时间锚定项，以 t=0 时分数为 1 作为基准，因此可以跨实体直接比较
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRegister implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * log2(分数) + lastTime / halfLife
     */
    private double logScore;

    /**
     * 最近一次计分时间（小时）
     */
    private double lastTime;

    /**
     * 从未计分过的寄存器
     *
     * @return (0, 0)
     */
    public static ScoreRegister initial() {
        return new ScoreRegister(0.0, 0.0);
    }

    public boolean isNew() {
        return lastTime == 0.0;
    }
}
