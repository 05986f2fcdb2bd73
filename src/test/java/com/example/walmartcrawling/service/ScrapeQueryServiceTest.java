package com.example.walmartcrawling.service;

import com.example.walmartcrawling.dto.ProductResponse;
import com.example.walmartcrawling.dto.TaskResponse;
import com.example.walmartcrawling.entity.Product;
import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import com.example.walmartcrawling.repository.ProductRepository;
import com.example.walmartcrawling.repository.ScrapeTaskRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(ScrapeQueryService.class)
class ScrapeQueryServiceTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2024, 5, 1, 9, 0);

    @Autowired
    private ScrapeQueryService queryService;

    @Autowired
    private ScrapeTaskRepository taskRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void tasksAreListedNewestFirst() {
        Long first = newTask("acme", "https://www.walmart.com/ip/1");
        Long second = newTask("acme", "https://www.walmart.com/ip/2");
        Long third = newTask("acme", "https://www.walmart.com/ip/3");
        Long otherClient = newTask("globex", "https://www.walmart.com/ip/4");
        // 등록 순서(id)와 다르게 생성 시각을 배치
        setCreatedAt(first, BASE.plusHours(2));
        setCreatedAt(second, BASE);
        setCreatedAt(third, BASE.plusHours(1));
        setCreatedAt(otherClient, BASE.plusHours(3));

        List<TaskResponse> tasks = queryService.listTasks("acme", null, null);

        assertThat(tasks).extracting(TaskResponse::getTaskId).containsExactly(first, third, second);
        assertThat(tasks).extracting(TaskResponse::getCreatedAt)
                .containsExactly(BASE.plusHours(2), BASE.plusHours(1), BASE);
    }

    @Test
    void productsAreListedNewestFirst() {
        Long older = newProduct("acme", BASE, 10.0);
        Long newest = newProduct("acme", BASE.plusDays(1), 20.0);
        Long middle = newProduct("acme", BASE.plusHours(5), 30.0);
        newProduct("globex", BASE.plusDays(2), 40.0);
        entityManager.flush();
        entityManager.clear();

        List<ProductResponse> products = queryService.listProducts("acme", null, null, null);

        assertThat(products).extracting(ProductResponse::getProductId).containsExactly(newest, middle, older);
        assertThat(products).extracting(ProductResponse::getScrapedAt)
                .containsExactly(BASE.plusDays(1), BASE.plusHours(5), BASE);
    }

    @Test
    void priceRangeKeepsNewestFirstOrder() {
        Long cheap = newProduct("acme", BASE.plusHours(3), 5.0);
        Long inRangeOld = newProduct("acme", BASE, 15.0);
        Long inRangeNew = newProduct("acme", BASE.plusHours(1), 25.0);
        entityManager.flush();
        entityManager.clear();

        List<ProductResponse> products = queryService.listProducts("acme", null, 10.0, 30.0);

        assertThat(products).extracting(ProductResponse::getProductId)
                .containsExactly(inRangeNew, inRangeOld)
                .doesNotContain(cheap);
    }

    @Test
    void invertedPriceRangeIsRejected() {
        assertThatThrownBy(() -> queryService.listProducts(null, null, 50.0, 10.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Long newTask(String clientName, String url) {
        return taskRepository.saveAndFlush(ScrapeTask.builder()
                .clientName(clientName)
                .category("tools")
                .url(url)
                .status(ScrapeTaskStatus.COMPLETED)
                .build()).getId();
    }

    private void setCreatedAt(Long taskId, LocalDateTime createdAt) {
        jdbcTemplate.update("update scrape_task set created_at = ? where id = ?", createdAt, taskId);
        entityManager.clear();
    }

    private Long newProduct(String clientName, LocalDateTime scrapedAt, double price) {
        ScrapeTask task = taskRepository.saveAndFlush(ScrapeTask.builder()
                .clientName(clientName)
                .category("tools")
                .url("https://www.walmart.com/ip/" + scrapedAt.hashCode())
                .status(ScrapeTaskStatus.COMPLETED)
                .build());
        return productRepository.saveAndFlush(Product.builder()
                .task(task)
                .clientName(clientName)
                .category("tools")
                .title("Item " + price)
                .price(price)
                .productUrl(task.getUrl())
                .scrapedAt(scrapedAt)
                .build()).getId();
    }
}
