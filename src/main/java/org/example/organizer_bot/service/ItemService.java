package org.example.organizer_bot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.model.Item;
import org.example.organizer_bot.model.ItemDraft;
import org.example.organizer_bot.model.ItemFilter;
import org.example.organizer_bot.model.ItemPatch;
import org.example.organizer_bot.repository.ItemRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Работа с товарами: создание, поиск, изменение, удаление.
 * <p>
 * Гонки между разными чатами (два юзера одновременно удаляют "X")
 * разруливает транзакция БД, а не диалоги.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ItemService {

    private final ItemRepository itemRepository;

    /**
     * Создать товар из черновика.
     *
     * @param draft     заполненный черновик
     * @param chatId    чат, в котором товар создаётся
     * @param creatorId Telegram ID создателя (может быть NULL)
     * @return сохранённый товар
     */
    @Transactional
    public Item create(ItemDraft draft, Long chatId, Long creatorId) {
        Item item = Item.builder()
                .name(draft.getName())
                .amount(draft.getAmount())
                .type(normalizeType(draft.getType()))
                .price(roundPrice(draft.getPrice()))
                .available(Boolean.TRUE.equals(draft.getAvailable()))
                .chatId(chatId)
                .createdByUserId(creatorId)
                .build();

        Item saved = itemRepository.save(item);
        log.info("Товар создан: itemId={}, chatId={}, creatorId={}", saved.getId(), chatId, creatorId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Item> getById(Long itemId) {
        return itemRepository.findById(itemId);
    }

    /**
     * Список товаров по фильтрам, новые сверху.
     */
    @Transactional(readOnly = true)
    public List<Item> list(ItemFilter filter, int limit) {
        String namePattern = null;
        if (filter.getNameSubstring() != null && !filter.getNameSubstring().isEmpty()) {
            namePattern = "%" + filter.getNameSubstring().toLowerCase(Locale.ROOT) + "%";
        }
        return itemRepository.search(
                filter.getChatId(),
                namePattern,
                filter.getCreatorId(),
                filter.getCreatedFrom(),
                filter.getCreatedTo(),
                PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Все товары чата с точно таким именем (без учёта регистра).
     */
    @Transactional(readOnly = true)
    public List<Item> findByExactName(Long chatId, String name) {
        return itemRepository.findByChatIdAndNameIgnoreCase(chatId, name);
    }

    /**
     * Поменять наличие у товаров с таким именем.
     *
     * @param chatId    NULL — во всех чатах
     * @param creatorId NULL — у всех создателей (админ), иначе только свои
     * @return сколько строк обновлено
     */
    @Transactional
    public int updateAvailability(String name, boolean available, Long chatId, Long creatorId) {
        int updated = itemRepository.updateAvailability(name, available, chatId, creatorId);
        log.info("Наличие обновлено: rows={}, chatId={}, creatorId={}, available={}",
                updated, chatId, creatorId, available);
        return updated;
    }

    /**
     * Удалить товары чата с таким именем.
     *
     * @param creatorId NULL — удалить все (админ), иначе только созданные этим юзером
     * @return сколько строк удалено
     */
    @Transactional
    public int deleteByNameAndChat(String name, Long chatId, Long creatorId) {
        int deleted = creatorId == null
                ? itemRepository.deleteByChatIdAndName(chatId, name)
                : itemRepository.deleteByChatIdAndNameAndCreator(chatId, name, creatorId);
        log.info("Удалено товаров: rows={}, chatId={}, creatorId={}", deleted, chatId, creatorId);
        return deleted;
    }

    /**
     * Применить накопленные правки к товару.
     *
     * @return обновлённый товар или пусто, если товара уже нет
     */
    @Transactional
    public Optional<Item> updateById(Long itemId, ItemPatch patch) {
        Optional<Item> opt = itemRepository.findById(itemId);
        if (opt.isEmpty()) {
            log.warn("Товар для изменения не найден: itemId={}", itemId);
            return Optional.empty();
        }
        Item item = opt.get();

        if (patch.getName() != null) {
            item.setName(patch.getName());
        }
        if (patch.getAmount() != null) {
            item.setAmount(patch.getAmount());
        }
        if (patch.getType() != null) {
            item.setType(normalizeType(patch.getType()));
        }
        if (patch.getPrice() != null) {
            item.setPrice(roundPrice(patch.getPrice()));
        }
        if (patch.getAvailable() != null) {
            item.setAvailable(patch.getAvailable());
        }

        Item saved = itemRepository.save(item);
        log.info("Товар изменён: itemId={}", itemId);
        return Optional.of(saved);
    }

    private static String normalizeType(String type) {
        return type == null ? null : type.toLowerCase(Locale.ROOT);
    }

    private static BigDecimal roundPrice(BigDecimal price) {
        return price == null ? null : price.setScale(2, RoundingMode.HALF_UP);
    }
}
