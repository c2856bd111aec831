package cn.bafuka.timecache.example.store;

import cn.bafuka.timecache.dataplane.DurableStore;
import cn.bafuka.timecache.dataplane.EntityQuery;
import cn.bafuka.timecache.example.entity.Post;
import cn.bafuka.timecache.example.mapper.PostMapper;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 基于 MyBatis-Plus 的帖子持久化存储
 * 排序下推到数据库，过滤条件在内存中执行
 */
@Slf4j
@Component
public class MybatisPostStore implements DurableStore<Post> {

    @Autowired
    private PostMapper postMapper;

    @Override
    public Post load(String keyName) {
        log.info("从数据库查询帖子: keyName={}", keyName);
        return postMapper.selectById(keyName);
    }

    @Override
    public String save(Post post) {
        if (postMapper.updateById(post) == 0) {
            postMapper.insert(post);
        }
        return post.getKeyName();
    }

    @Override
    public List<Post> queryByFilter(EntityQuery<Post> query) {
        QueryWrapper<Post> wrapper = new QueryWrapper<>();
        if (query.getOrder() != null) {
            wrapper.orderBy(true, !query.getOrder().isDescending(), query.getOrder().getProperty());
        }
        if (query.getFilter() == null) {
            wrapper.last("limit " + query.getLimit());
        }

        return postMapper.selectList(wrapper).stream()
                .filter(query::matches)
                .limit(query.getLimit())
                .collect(Collectors.toList());
    }
}
