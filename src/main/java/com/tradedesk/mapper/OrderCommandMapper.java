package com.tradedesk.mapper;

import com.tradedesk.api.dto.request.PlaceOptionOrderRequest;
import com.tradedesk.api.dto.request.PlaceStockOrderRequest;
import com.tradedesk.api.dto.response.OrderCommandResponse;
import com.tradedesk.api.dto.response.PlaceOrderResponse;
import com.tradedesk.api.dto.response.SessionHealthResponse;
import com.tradedesk.oms.OrderCommandResult;
import com.tradedesk.oms.OrderRequest;
import com.tradedesk.oms.PlaceOrderResult;
import com.tradedesk.session.SessionHealth;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the command API DTOs and the OMS request/result types.
 * Stock requests carry no option fields, which stay null on the OrderRequest.
 */
@Mapper(componentModel = "spring")
public interface OrderCommandMapper {

    @Mapping(target = "expiry", ignore = true)
    @Mapping(target = "strike", ignore = true)
    @Mapping(target = "right", ignore = true)
    OrderRequest toOrderRequest(PlaceStockOrderRequest request);

    OrderRequest toOrderRequest(PlaceOptionOrderRequest request);

    PlaceOrderResponse toResponse(PlaceOrderResult result);

    OrderCommandResponse toResponse(OrderCommandResult result);

    SessionHealthResponse toResponse(SessionHealth health);
}
