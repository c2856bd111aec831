package cn.bafuka.timecache.example.entity;

import cn.bafuka.timecache.core.EntryState;
import cn.bafuka.timecache.core.Migratable;
import cn.bafuka.timecache.score.HalfLives;
import cn.bafuka.timecache.score.Scorable;
import cn.bafuka.timecache.score.ScoreRegister;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 帖子
 * 各半衰期的分数共用一个计分时间 scoreHours
 */
@Data
@TableName("post")
public class Post implements Scorable, Migratable {

    private static final long serialVersionUID = 1L;

    /**
     * 当前模式版本：2 版本新增摘要字段
     */
    public static final int SCHEMA_VERSION = 2;

    private static final int SUMMARY_LENGTH = 80;

    @TableId(type = IdType.INPUT)
    private String keyName;

    private String title;

    private String content;

    private String summary;

    private double scoreDay;

    private double scoreWeek;

    private double scoreMonth;

    private double scoreYear;

    private double scoreHours;

    private int schemaVersion = SCHEMA_VERSION;

    @JsonIgnore
    @TableField(exist = false)
    private EntryState entryState = new EntryState();

    public static Post create(String keyName, String title, String content) {
        Post post = new Post();
        post.setKeyName(keyName);
        post.setTitle(title);
        post.setContent(content);
        post.setSummary(summarize(content));
        return post;
    }

    @Override
    public ScoreRegister getScoreRegister(double halfLife) {
        return new ScoreRegister(scoreField(halfLife), scoreHours);
    }

    @Override
    public void setScoreRegister(double halfLife, ScoreRegister register) {
        if (halfLife == HalfLives.DAY) {
            scoreDay = register.getLogScore();
        } else if (halfLife == HalfLives.WEEK) {
            scoreWeek = register.getLogScore();
        } else if (halfLife == HalfLives.MONTH) {
            scoreMonth = register.getLogScore();
        } else if (halfLife == HalfLives.YEAR) {
            scoreYear = register.getLogScore();
        } else {
            throw new IllegalArgumentException("Unsupported half-life: " + halfLife);
        }
        scoreHours = register.getLastTime();
    }

    @Override
    public int currentSchemaVersion() {
        return SCHEMA_VERSION;
    }

    @Override
    public void migrate(int nextVersion) {
        if (nextVersion == 2) {
            summary = summarize(content);
            return;
        }
        Migratable.super.migrate(nextVersion);
    }

    private double scoreField(double halfLife) {
        if (halfLife == HalfLives.DAY) {
            return scoreDay;
        }
        if (halfLife == HalfLives.WEEK) {
            return scoreWeek;
        }
        if (halfLife == HalfLives.MONTH) {
            return scoreMonth;
        }
        if (halfLife == HalfLives.YEAR) {
            return scoreYear;
        }
        throw new IllegalArgumentException("Unsupported half-life: " + halfLife);
    }

    private static String summarize(String content) {
        if (content == null) {
            return "";
        }
        return content.length() <= SUMMARY_LENGTH ? content : content.substring(0, SUMMARY_LENGTH);
    }
}
